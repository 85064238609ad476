package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.DraftProspect;

import java.util.List;

/**
 * Suite de choix IA jusqu'au tour du joueur (ou la fin du round).
 *
 * @param nextPick         numéro global du prochain choix
 * @param playerOnTheClock vrai si la boucle s'est arrêtée sur le créneau du joueur humain
 */
public record AiDraftRound(List<AiDraftPick> picks, List<DraftProspect> remainingProspects, int nextPick,
                           boolean playerOnTheClock) {}
