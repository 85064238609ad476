package com.tony.franchiseSimulator.model.result;

/** Résultat d'une demande de scouting : rapport ou motif de refus. */
public record ScoutingOutcome(boolean success, String reason, ScoutingReport report) {

    public static ScoutingOutcome success(ScoutingReport report) {
        return new ScoutingOutcome(true, null, report);
    }

    public static ScoutingOutcome failure(String reason) {
        return new ScoutingOutcome(false, reason, null);
    }
}
