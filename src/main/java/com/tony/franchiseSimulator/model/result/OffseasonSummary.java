package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.Player;

import java.util.List;

/**
 * Résultat de l'intersaison.
 *
 * @param roster           joueurs qui restent dans l'organisation, vieillis et remis à zéro
 * @param retiredPlayers   joueurs partis à la retraite
 * @param releasedPlayers  joueurs en fin de contrat, libérés
 * @param mvp              null si le roster était vide
 */
public record OffseasonSummary(
        int completedSeason,
        List<Player> roster,
        List<Player> retiredPlayers,
        List<Player> releasedPlayers,
        List<DraftOrderEntry> draftOrder,
        int playerDraftPosition,
        SeasonMvp mvp
) {}
