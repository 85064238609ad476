package com.tony.franchiseSimulator.model.dto;

import com.tony.franchiseSimulator.model.Player;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
public class ContractRenewalRequest {
    private List<Player> players = new ArrayList<>();

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double teamWinPct = 0.5;

    // Joueurs en fin de contrat à qui la franchise ne fait pas d'offre
    private Set<String> releasedPlayerIds = new HashSet<>();
}
