package com.tony.franchiseSimulator.model;

/**
 * Traits révélés par le scouting. Un champ null signifie "non révélé".
 */
public record RevealedTraits(
        WorkEthic workEthic,
        Personality personality,
        Boolean injuryProne,
        Integer coachability,
        Integer clutch
) {
    public static RevealedTraits none() {
        return new RevealedTraits(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return workEthic == null && personality == null && injuryProne == null
                && coachability == null && clutch == null;
    }
}
