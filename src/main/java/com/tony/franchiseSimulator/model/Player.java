package com.tony.franchiseSimulator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Joueur sous contrat dans l'organisation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Player {
    private String id;
    private String firstName;
    private String lastName;
    private int age;
    private Position position;
    private PlayerType playerType;
    private Tier tier;

    private int currentRating;
    private int potential;

    @Builder.Default
    private Map<Tool, Integer> attributes = new EnumMap<>(Tool.class);

    private HiddenTraits hiddenTraits;

    // --- État ---
    @Builder.Default
    private int morale = 50;
    @Builder.Default
    private int confidence = 50;
    private boolean injured;
    private int injuryWeeks;
    @Builder.Default
    private RosterStatus rosterStatus = RosterStatus.RESERVE;
    @Builder.Default
    private boolean onRoster = true;

    // --- Contrat ---
    private long salary;
    private int contractYears;
    private int yearsInOrg;
    private Integer draftYear;
    private Integer draftRound;
    private Integer draftPick;

    // --- Développement ---
    @Builder.Default
    private TrainingFocus trainingFocus = TrainingFocus.OVERALL;
    private int currentXp;
    @Builder.Default
    private double progressionRate = 1.0;

    // --- Statistiques ---
    private SeasonStatLine seasonStats;
    @Builder.Default
    private List<SeasonStatsSummary> careerStats = new ArrayList<>();

    public int getAttribute(Tool tool) {
        return attributes.getOrDefault(tool, 20);
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }
}
