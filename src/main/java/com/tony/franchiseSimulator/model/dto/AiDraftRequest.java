package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.DraftProspect;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Sert aux deux routes IA : un seul choix ({@code teamId}) ou la suite de choix jusqu'au joueur.
 */
@Data
public class AiDraftRequest {
    private String teamId;

    @NotNull
    private List<DraftProspect> prospects = new ArrayList<>();

    @Min(1)
    private int round = 1;

    @Min(1)
    private int currentPick = 1;

    @Min(1)
    private int playerDraftPosition = 1;

    private boolean snakeDraft = true;
}
