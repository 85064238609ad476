package com.tony.franchiseSimulator.model.result;

import java.util.List;

/**
 * Classement final, du meilleur pourcentage au plus faible.
 *
 * @param playerRank rang de la franchise du joueur (1-based)
 */
public record LeagueStandings(List<TeamStanding> standings, int playerRank, boolean madePlayoffs, boolean wonDivision) {}
