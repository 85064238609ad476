package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.DraftProspect;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ScoutingRequest {
    @NotNull
    @Valid
    private DraftProspect prospect;

    // "low", "medium" ou "high" : un code inconnu donne un refus, pas une erreur 400
    private String accuracy;

    private long availableFunds;
}
