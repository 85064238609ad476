package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.CityState;

import java.util.List;

public record CityGrowthResult(
        double successScore,
        int buildingsUpgraded,
        CityState city,
        List<BuildingUpgrade> buildingChanges,
        List<CityEvent> events
) {}
