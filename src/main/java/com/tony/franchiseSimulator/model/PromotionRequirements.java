package com.tony.franchiseSimulator.model;

/** Critères de promotion vers le niveau supérieur. Tous doivent être remplis simultanément. */
public record PromotionRequirements(
        double minWinPct,
        long minReserves,
        int minTeamPride,
        int consecutiveWinningSeasons,
        boolean requiresDivisionTitle,
        boolean requiresLeagueChampionship
) {}
