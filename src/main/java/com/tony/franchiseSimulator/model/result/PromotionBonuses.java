package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.Tier;

public record PromotionBonuses(Tier fromTier, Tier toTier, long budgetIncrease, int stadiumCapacityIncrease,
                               int prideBoost) {}
