package com.tony.franchiseSimulator.model.result;

/**
 * @param declineModifier 0 jusqu'à 32 ans, puis -0.5 par année supplémentaire
 */
public record AgingResult(int newAge, boolean retiring, double declineModifier) {}
