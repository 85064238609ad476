package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.Tier;

import java.util.List;

/**
 * @param nextTier null au sommet (MLB)
 */
public record PromotionEligibility(
        boolean eligible,
        Tier currentTier,
        Tier nextTier,
        List<String> metCriteria,
        List<String> missingCriteria,
        List<RequirementCheck> requirements
) {
    /** Part des critères remplis, en %. 100 au sommet. */
    public int progressPercent() {
        if (nextTier == null) return 100;
        int total = metCriteria.size() + missingCriteria.size();
        if (total == 0) return 0;
        return (int) Math.round(metCriteria.size() * 100.0 / total);
    }
}
