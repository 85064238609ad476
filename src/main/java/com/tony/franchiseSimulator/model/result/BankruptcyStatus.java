package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.BankruptcyRisk;

import java.util.List;

/**
 * Diagnostic de solvabilité avec pistes de redressement. {@code bankrupt} marque la ligne de fin de partie.
 */
public record BankruptcyStatus(boolean bankrupt, double debtRatio, BankruptcyRisk riskLevel, String message,
                               List<String> recoveryOptions) {}
