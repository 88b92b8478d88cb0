package com.ledgerwise.core.planner;

import com.ledgerwise.core.model.Plan;

/**
 * Thrown when a plan cannot be made executable: a required parameter has no
 * producer, the steps reference each other in a cycle, or resolution does
 * not converge.
 */
public class PlanRejectedException extends Exception {

    private final Plan plan;

    public PlanRejectedException(String message, Plan plan) {
        super(message);
        this.plan = plan;
    }

    /** The plan as far as resolution got. */
    public Plan plan() {
        return plan;
    }
}
