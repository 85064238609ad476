package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.DraftProspect;
import com.tony.franchiseSimulator.model.Tier;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DraftSelectionRequest {
    @NotNull
    private DraftProspect prospect;

    @NotNull
    private Tier tier;

    private int year;

    @Min(1)
    private int round = 1;

    @Min(1)
    private int pickNumber = 1;
}
