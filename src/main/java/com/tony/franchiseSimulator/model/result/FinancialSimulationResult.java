package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.BankruptcyRisk;

/**
 * Bilan d'une saison. {@code netIncome = revenue.total - expenses.total} et
 * {@code newReserves = réserves initiales + netIncome}, sans arrondi supplémentaire.
 */
public record FinancialSimulationResult(
        RevenueBreakdown revenue,
        ExpenseBreakdown expenses,
        long netIncome,
        long newReserves,
        long debtLevel,
        BankruptcyRisk bankruptcyRisk
) {}
