package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.GameStatus;

public record GameStatusCheck(GameStatus status, String reason, long totalDebt, long debtThreshold, boolean inDebt,
                              boolean bankrupt) {}
