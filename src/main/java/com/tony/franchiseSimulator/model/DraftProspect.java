package com.tony.franchiseSimulator.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Candidat à la draft. Les notes "vraies" sont cachées au joueur ; seules les estimations
 * de scouting (nulles tant que le prospect n'a pas été observé) lui sont montrées.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DraftProspect {
    private String id;
    private String firstName;
    private String lastName;
    private int age;
    private Position position;
    private PlayerType playerType;
    private int draftYear;

    // Notes réelles [20-80]
    private int currentRating;
    private int potential;

    @Builder.Default
    private Map<Tool, Integer> attributes = new EnumMap<>(Tool.class);

    @NotNull
    private HiddenTraits hiddenTraits;

    // Dérivés, calculés une fois à la génération
    private Archetype archetype;
    private int mediaRank;

    // --- Scouting ---
    private Integer scoutedRating;
    private Integer scoutedPotential;
    private ScoutingAccuracy scoutingAccuracy;
    @Builder.Default
    private RevealedTraits revealedTraits = RevealedTraits.none();

    // --- Draft ---
    private boolean drafted;
    private String draftedByTeam;

    public int getAttribute(Tool tool) {
        return attributes.getOrDefault(tool, 20);
    }

    public boolean isScouted() {
        return scoutingAccuracy != null;
    }
}
