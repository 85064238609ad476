package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.Player;

import java.util.List;

/**
 * @param updatedPlayers roster après application des gains (les joueurs hors roster sont inchangés)
 */
public record BatchTrainingResult(List<TrainingResult> trainedPlayers, List<Player> updatedPlayers,
                                  int totalXpGained, int playersLeveledUp) {}
