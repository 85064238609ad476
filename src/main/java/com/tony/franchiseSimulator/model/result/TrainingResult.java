package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.Tool;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effet d'un lot de matchs sur un joueur. Les champs d'attribut sont nuls sans montée de niveau.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainingResult {
    private String playerId;
    private int previousXp;
    private int newXp;
    private int xpGained;
    private boolean leveledUp;
    private Tool attributeImproved;
    private Integer previousValue;
    private Integer newValue;
}
