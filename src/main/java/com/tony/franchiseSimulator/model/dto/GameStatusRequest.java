package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.Tier;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class GameStatusRequest {
    private long reserves;
    private long annualBudget;
    @NotNull
    private Tier tier;
}
