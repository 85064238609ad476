package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.CityState;
import com.tony.franchiseSimulator.model.Franchise;
import com.tony.franchiseSimulator.model.Player;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class FinanceRequest {
    private List<Player> players = new ArrayList<>();

    @NotNull
    @Valid
    private Franchise franchise;

    @NotNull
    private CityState cityState;

    @Min(0)
    private long attendance;

    private boolean wonChampionship;

    @Min(0)
    private long marketingSpend;
}
