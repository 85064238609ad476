package com.tony.franchiseSimulator.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DraftClassRequest {
    // Null = taille configurée par défaut
    @Min(0)
    @Max(5000)
    private Integer totalPlayers;

    @NotNull
    private Integer year;
}
