package com.tony.franchiseSimulator.model;

import java.util.Optional;

/**
 * Niveau des installations : capacité de la réserve, vitesse d'entraînement et coût du niveau suivant.
 */
public enum FacilityLevel {
    BASIC(5, 1.0, 150_000L),
    IMPROVED(20, 1.15, 500_000L),
    ELITE(40, 1.30, null);

    public static final int ACTIVE_ROSTER_LIMIT = 25;

    private final int reserveSlots;
    private final double trainingMultiplier;
    private final Long upgradeCost;

    FacilityLevel(int reserveSlots, double trainingMultiplier, Long upgradeCost) {
        this.reserveSlots = reserveSlots;
        this.trainingMultiplier = trainingMultiplier;
        this.upgradeCost = upgradeCost;
    }

    public int getReserveSlots() {
        return reserveSlots;
    }

    public double getTrainingMultiplier() {
        return trainingMultiplier;
    }

    /** Coût pour passer au niveau suivant ; vide au niveau maximal. */
    public Optional<Long> getUpgradeCost() {
        return Optional.ofNullable(upgradeCost);
    }

    public int totalRosterCapacity() {
        return ACTIVE_ROSTER_LIMIT + reserveSlots;
    }

    public static FacilityLevel ofLevel(int level) {
        if (level < 0 || level >= values().length) {
            throw new IllegalArgumentException("Niveau d'installations invalide : " + level);
        }
        return values()[level];
    }
}
