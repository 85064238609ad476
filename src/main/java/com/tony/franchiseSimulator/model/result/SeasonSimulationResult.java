package com.tony.franchiseSimulator.model.result;

import java.util.List;

/**
 * Bilan statistique d'une saison : record, classement, séries, affluence et blessures.
 * Les valeurs alimentent directement les finances, la promotion, la croissance de la ville et l'ordre de draft.
 */
public record SeasonSimulationResult(
        int wins,
        int losses,
        double winPct,
        int divisionRank,
        boolean madePlayoffs,
        boolean wonDivision,
        boolean wonChampionship,
        boolean wonWorldSeries,
        double teamStrength,
        int averageAttendance,
        long totalAttendance,
        double attendanceRate,
        List<PlayerInjury> injuries
) {}
