package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

/**
 * The per-review cost or attempt budget does not allow another provider call.
 */
@Getter
public class BudgetExhaustedException extends RuntimeException {

    private final double spent;
    private final double limit;
    private final int attempts;

    public BudgetExhaustedException(String message, double spent, double limit, int attempts) {
        super(message);
        this.spent = spent;
        this.limit = limit;
        this.attempts = attempts;
    }
}
