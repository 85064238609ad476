package com.tony.franchiseSimulator.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Instantané de la franchise fourni par l'appelant.
 * {@code budget} est le plafond fixé par le niveau ; {@code reserves} est le solde signé (négatif = dette).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Franchise {
    private String name;
    @NotNull
    private Tier tier;
    private long budget;
    private long reserves;

    // Stade
    private String stadiumName;
    private int stadiumCapacity;
    private int stadiumQuality;
    private double ticketPrice;

    // Staff
    private long hittingCoachSalary;
    private long pitchingCoachSalary;
    private long developmentCoordinatorSalary;

    @Builder.Default
    private FacilityLevel facilityLevel = FacilityLevel.BASIC;

    private int consecutiveWinningSeasons;

    public long getCoachingSalaries() {
        return hittingCoachSalary + pitchingCoachSalary + developmentCoordinatorSalary;
    }
}
