package com.tony.franchiseSimulator.model;

/** Bilan de la saison écoulée pour la franchise du joueur humain. */
public record PlayerSeasonRecord(String teamName, int wins, int losses) {

    public int gamesPlayed() {
        return wins + losses;
    }
}
