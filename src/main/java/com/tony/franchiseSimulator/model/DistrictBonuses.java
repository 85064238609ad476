package com.tony.franchiseSimulator.model;

/** Multiplicateurs issus des quartiers de la ville (1.0 = aucun effet). */
public record DistrictBonuses(double incomeMultiplier, double fanMultiplier, double trainingMultiplier) {

    public static DistrictBonuses neutral() {
        return new DistrictBonuses(1.0, 1.0, 1.0);
    }
}
