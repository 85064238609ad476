package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.FreeAgentOutcome;

/**
 * @param newContract renseigné si le joueur re-signe
 * @param destination équipe IA rejointe si le joueur part
 */
public record FreeAgentResult(String playerId, String playerName, FreeAgentOutcome outcome,
                              ContractOffer newContract, String destination) {}
