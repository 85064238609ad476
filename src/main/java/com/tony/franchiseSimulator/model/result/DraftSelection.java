package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.DraftProspect;
import com.tony.franchiseSimulator.model.Player;

/**
 * Choix du joueur humain : le prospect marqué drafté et la recrue signée, ou un motif de refus.
 */
public record DraftSelection(boolean success, String reason, DraftProspect prospect, Player player,
                             ContractOffer contract) {

    public static DraftSelection failure(String reason) {
        return new DraftSelection(false, reason, null, null, null);
    }
}
