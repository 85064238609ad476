package com.tony.franchiseSimulator.model;

public enum BuildingType {
    RESTAURANT(DistrictType.ENTERTAINMENT, 0.02, Tier.LOW_A),
    BAR(DistrictType.ENTERTAINMENT, 0.025, Tier.LOW_A),
    RETAIL(DistrictType.COMMERCIAL, 0.02, Tier.LOW_A),
    HOTEL(DistrictType.COMMERCIAL, 0.05, Tier.HIGH_A),
    CORPORATE(DistrictType.PERFORMANCE, 0.03, Tier.DOUBLE_A);

    private final DistrictType district;
    private final double bonus;
    private final Tier minimumTier;

    BuildingType(DistrictType district, double bonus, Tier minimumTier) {
        this.district = district;
        this.bonus = bonus;
        this.minimumTier = minimumTier;
    }

    public DistrictType getDistrict() {
        return district;
    }

    /** Bonus additif apporté au multiplicateur de son quartier quand le bâtiment est ouvert. */
    public double getBonus() {
        return bonus;
    }

    public Tier getMinimumTier() {
        return minimumTier;
    }
}
