package com.tony.franchiseSimulator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CityState {
    public static final int BUILDING_COUNT = 50;

    private int population;
    private int medianIncome;
    private double unemploymentRate;

    // 0-100
    private int teamPride;
    private int nationalRecognition;

    @Builder.Default
    private List<Building> buildings = new ArrayList<>();
}
