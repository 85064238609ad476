package com.tony.franchiseSimulator.model.result;

/**
 * @param qualifyingOffer offre de renouvellement faite à un joueur en fin de contrat
 */
public record ContractOffer(long salary, int years, long totalValue, boolean rookieContract, boolean qualifyingOffer) {}
