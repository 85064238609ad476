package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.Tier;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PromotionCheckRequest {
    @NotNull
    private Tier tier;
    private double winPct;
    private long reserves;
    private int teamPride;
    private int consecutiveWinningSeasons;
    private boolean wonDivision;
    private boolean wonChampionship;
}
