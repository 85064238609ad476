package com.tony.franchiseSimulator.model.result;

public record SolvencyReport(BankruptcyStatus bankruptcyStatus, DebtWarning debtWarning, GameStatusCheck gameStatus) {}
