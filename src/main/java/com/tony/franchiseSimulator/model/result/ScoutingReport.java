package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.RevealedTraits;
import com.tony.franchiseSimulator.model.ScoutingAccuracy;

/**
 * Estimation bruitée d'un prospect. Le prospect lui-même n'est jamais modifié.
 *
 * @param ratingError    écart absolu entre l'estimation et la note réelle
 * @param potentialError écart absolu entre l'estimation et le potentiel réel
 */
public record ScoutingReport(
        String prospectId,
        ScoutingAccuracy accuracy,
        int scoutedRating,
        int scoutedPotential,
        RevealedTraits revealedTraits,
        boolean traitsRevealed,
        long cost,
        int ratingError,
        int potentialError
) {}
