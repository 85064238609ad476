package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.Building;
import com.tony.franchiseSimulator.model.FacilityLevel;
import com.tony.franchiseSimulator.model.Player;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class TrainingRequest {
    // Un seul joueur pour /training, tout le roster pour /training/batch
    @NotEmpty
    private List<Player> players = new ArrayList<>();

    // Bâtiments de la ville, d'où sont tirés les bonus de quartier
    private List<Building> buildings = new ArrayList<>();

    private FacilityLevel facilityLevel = FacilityLevel.BASIC;

    @Min(0)
    private int gamesSimulated;
}
