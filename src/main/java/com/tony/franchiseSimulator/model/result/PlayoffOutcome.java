package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.PlayoffRound;

/**
 * @param eliminatedIn tour de l'élimination ; null si non qualifié ou parcours mené à son terme
 */
public record PlayoffOutcome(boolean wonChampionship, boolean wonWorldSeries, PlayoffRound eliminatedIn) {

    public static PlayoffOutcome missed() {
        return new PlayoffOutcome(false, false, null);
    }
}
