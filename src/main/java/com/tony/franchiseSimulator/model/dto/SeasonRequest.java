package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.Building;
import com.tony.franchiseSimulator.model.Player;
import com.tony.franchiseSimulator.model.Tier;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SeasonRequest {
    private List<Player> players = new ArrayList<>();

    @NotNull
    private Tier tier;

    // Compétence des entraîneurs, échelle 20-80
    @Min(20)
    @Max(80)
    private int hittingCoachSkill = 50;
    @Min(20)
    @Max(80)
    private int pitchingCoachSkill = 50;

    // 0 = capacité par défaut du niveau
    @Min(0)
    private int stadiumCapacity;
    @Min(0)
    @Max(100)
    private int stadiumQuality = 50;

    @Min(0)
    @Max(100)
    private int cityPride = 30;
    @Min(0)
    @Max(100)
    private double unemploymentRate;

    // Bâtiments de la ville : le quartier divertissement dope l'affluence
    private List<Building> buildings = new ArrayList<>();
}
