package com.tony.franchiseSimulator.model.result;

/**
 * Choix d'une équipe IA. {@code selectedIndex} indexe la liste de prospects fournie ; -1 si aucun choix possible.
 */
public record DraftPickDecision(int selectedIndex, String prospectId, double score, String reason) {

    public static DraftPickDecision noSelection(String reason) {
        return new DraftPickDecision(-1, null, 0.0, reason);
    }

    public boolean hasSelection() {
        return selectedIndex >= 0;
    }
}
