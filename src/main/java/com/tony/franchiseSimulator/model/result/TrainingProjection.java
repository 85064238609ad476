package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.TrainingFocus;

/** Projection sans aléa : XP moyenne par match et nombre de matchs avant la prochaine progression. */
public record TrainingProjection(String playerId, double estimatedXpPerGame, int estimatedGamesToLevelUp,
                                 double progressionRate, TrainingFocus recommendedFocus) {}
