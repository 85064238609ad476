package com.tony.franchiseSimulator.model;

import java.util.Optional;

/**
 * Constantes d'un niveau. Immuable : jamais modifié en cours de partie.
 */
public record TierConfig(
        Tier tier,
        String displayName,
        long budget,
        long minSalary,
        long maxSalary,
        int stadiumCapacity,
        int seasonLength,
        int ticketPriceMin,
        int ticketPriceMax,
        long scoutingBudget,
        long stadiumValue,
        long travelCost,
        int averageOpponentStrength,
        int population,
        double unemploymentRate,
        int medianIncome,
        PromotionRequirements promotion
) {
    /** Vide pour la MLB (pas de niveau supérieur). */
    public Optional<PromotionRequirements> promotionRequirements() {
        return Optional.ofNullable(promotion);
    }
}
