package com.tony.franchiseSimulator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ligne d'historique de carrière archivée en fin de saison.
 * Les champs du type opposé (frappe pour un lanceur et inversement) restent nuls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeasonStatsSummary {
    private int year;
    private Tier tier;
    private int gamesPlayed;

    // Frappeur
    private Double battingAverage;
    private Integer homeRuns;
    private Integer rbi;
    private Integer stolenBases;

    // Lanceur
    private Integer wins;
    private Integer losses;
    private Double era;
    private Integer saves;
    private Integer strikeouts;
}
