package com.tony.franchiseSimulator.model.result;

import java.util.List;

/**
 * Masse salariale du roster actif face au plafond du niveau.
 *
 * @param playerSalaries du plus gros salaire au plus petit
 */
public record PayrollSummary(
        long totalPayroll,
        long salaryCap,
        long capSpace,
        boolean overCap,
        long luxuryTaxThreshold,
        boolean inLuxuryTax,
        List<PlayerSalary> playerSalaries
) {}
