package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.Player;
import com.tony.franchiseSimulator.model.Tier;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PayrollRequest {
    private List<Player> players = new ArrayList<>();

    @NotNull
    private Tier tier;
}
