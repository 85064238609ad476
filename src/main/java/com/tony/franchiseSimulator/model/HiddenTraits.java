package com.tony.franchiseSimulator.model;

/**
 * Traits cachés, tirés une seule fois à la génération du joueur.
 */
public record HiddenTraits(
        WorkEthic workEthic,
        boolean injuryProne,
        Personality personality,
        int coachability,
        int clutch
) {}
