package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.CityState;
import com.tony.franchiseSimulator.model.Tier;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CityGrowthRequest {
    @NotNull
    private CityState cityState;

    @NotNull
    private Tier tier;

    private int year;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double winPct;

    // Affluence moyenne / capacité du stade
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double attendanceRate;

    private boolean madePlayoffs;
    private boolean wonChampionship;
    private boolean wonWorldSeries;
}
