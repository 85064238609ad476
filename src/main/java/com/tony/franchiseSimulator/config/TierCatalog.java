package com.tony.franchiseSimulator.config;

import com.tony.franchiseSimulator.model.PromotionRequirements;
import com.tony.franchiseSimulator.model.Tier;
import com.tony.franchiseSimulator.model.TierConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Table immuable des constantes par niveau.
 */
public class TierCatalog {

    private final Map<Tier, TierConfig> configs;

    public TierCatalog(Map<Tier, TierConfig> configs) {
        EnumMap<Tier, TierConfig> copy = new EnumMap<>(Tier.class);
        copy.putAll(configs);
        for (Tier tier : Tier.values()) {
            if (!copy.containsKey(tier)) {
                throw new IllegalArgumentException("Configuration manquante pour le niveau " + tier);
            }
        }
        this.configs = Collections.unmodifiableMap(copy);
    }

    public TierConfig get(Tier tier) {
        return configs.get(tier);
    }

    public Map<Tier, TierConfig> asMap() {
        return configs;
    }

    public static TierCatalog defaults() {
        Map<Tier, TierConfig> map = new EnumMap<>(Tier.class);
        map.put(Tier.LOW_A, new TierConfig(Tier.LOW_A, "Low-A",
                500_000L, 10_000L, 60_000L, 2_500, 132, 5, 12,
                50_000L, 5_000_000L, 50_000L, 42, 15_000, 18.0, 32_000,
                new PromotionRequirements(0.55, 50_000L, 50, 2, false, false)));
        map.put(Tier.HIGH_A, new TierConfig(Tier.HIGH_A, "High-A",
                2_000_000L, 30_000L, 150_000L, 5_000, 132, 8, 20,
                150_000L, 15_000_000L, 100_000L, 48, 25_000, 12.0, 38_000,
                new PromotionRequirements(0.575, 200_000L, 60, 2, true, false)));
        map.put(Tier.DOUBLE_A, new TierConfig(Tier.DOUBLE_A, "Double-A",
                8_000_000L, 100_000L, 500_000L, 10_000, 138, 12, 35,
                300_000L, 40_000_000L, 200_000L, 55, 45_000, 7.0, 48_000,
                new PromotionRequirements(0.60, 500_000L, 70, 2, true, false)));
        map.put(Tier.TRIPLE_A, new TierConfig(Tier.TRIPLE_A, "Triple-A",
                25_000_000L, 300_000L, 1_500_000L, 18_000, 144, 18, 55,
                500_000L, 80_000_000L, 350_000L, 62, 85_000, 4.0, 58_000,
                new PromotionRequirements(0.60, 2_000_000L, 80, 2, false, true)));
        map.put(Tier.MLB, new TierConfig(Tier.MLB, "MLB",
                150_000_000L, 750_000L, 35_000_000L, 42_000, 162, 25, 150,
                2_000_000L, 500_000_000L, 500_000L, 70, 200_000, 3.0, 72_000,
                null));
        return new TierCatalog(map);
    }
}
