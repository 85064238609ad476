package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.Player;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class OffseasonRequest {
    private List<Player> players = new ArrayList<>();

    private String teamName;

    @Min(0)
    private int wins;

    @Min(0)
    private int losses;

    private int completedSeason;
}
