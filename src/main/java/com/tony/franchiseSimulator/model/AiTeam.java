package com.tony.franchiseSimulator.model;

import java.util.List;
import java.util.Optional;

/**
 * Configuration statique d'une franchise contrôlée par l'IA.
 *
 * @param riskTolerance      0-100
 * @param baseStrength       force simulée (détermine le bilan de saison)
 * @param varianceMultiplier amplitude de la variance de son bilan
 */
public record AiTeam(
        String id,
        String name,
        String city,
        DraftStrategy philosophy,
        int riskTolerance,
        List<PositionNeed> needs,
        int baseStrength,
        double varianceMultiplier
) {
    public AiTeam {
        needs = needs == null ? List.of() : List.copyOf(needs);
    }

    public Optional<PositionNeed> needFor(Position position) {
        return needs.stream().filter(n -> n.position() == position).findFirst();
    }
}
