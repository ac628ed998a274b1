package com.purchasingpower.reviewflow.orchestration;

import com.purchasingpower.reviewflow.exception.BudgetExhaustedException;
import lombok.extern.slf4j.Slf4j;

/**
 * Spend and attempt allowance of one review. Shared by the tiers of that review only.
 *
 * <p>Every provider attempt must be reserved first; the reservation fails when the
 * attempt cap is reached or the estimated cost would exceed the remaining budget.
 * Once a reservation has failed the budget stays exhausted.
 */
@Slf4j
public class CostBudget {

    private final String reviewId;
    private final double limit;
    private final int maxAttempts;

    private double spent;
    private int attempts;
    private boolean exhausted;

    public CostBudget(String reviewId, double limit, int maxAttempts) {
        this.reviewId = reviewId;
        this.limit = limit;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Reserves one provider attempt with the given estimated cost.
     *
     * @throws BudgetExhaustedException when the attempt is not allowed
     */
    public synchronized void reserve(String providerId, double estimatedCost) {
        if (exhausted) {
            throw exhaustedException("budget already exhausted");
        }
        if (attempts >= maxAttempts) {
            exhausted = true;
            throw exhaustedException("attempt cap " + maxAttempts + " reached");
        }
        if (spent + estimatedCost > limit) {
            exhausted = true;
            throw exhaustedException(String.format("estimated $%.6f for %s exceeds remaining $%.6f",
                    estimatedCost, providerId, limit - spent));
        }
        attempts++;
    }

    public synchronized void charge(double actualCost) {
        spent += Math.max(0.0, actualCost);
        if (spent >= limit && limit > 0) {
            log.info("💸 Review {} spent its whole model budget (${})", reviewId, String.format("%.6f", spent));
        }
    }

    public synchronized double getSpent() {
        return spent;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public double getLimit() {
        return limit;
    }

    private BudgetExhaustedException exhaustedException(String reason) {
        return new BudgetExhaustedException("Review " + reviewId + ": " + reason, spent, limit, attempts);
    }
}
