package com.tony.franchiseSimulator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Compteurs bruts d'une saison en cours (frappe et lancer). */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeasonStatLine {
    private int gamesPlayed;

    // Frappe
    private int atBats;
    private int hits;
    private int homeRuns;
    private int rbi;
    private int runs;
    private int stolenBases;
    private int walks;
    private int strikeouts;

    // Lancer
    private int wins;
    private int losses;
    private int saves;
    private double inningsPitched;
    private int earnedRuns;
    private int pitchingStrikeouts;
    private int pitchingWalks;
}
