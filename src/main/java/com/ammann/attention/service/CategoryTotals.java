/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.dto.CategoryBreakdownDTO;
import com.ammann.attention.enumeration.ActivityCategory;

/**
 * Mutable per-category second counters used while folding contributions into a bucket.
 *
 * <p>Uncategorised time is counted as {@code neutral}.
 */
public final class CategoryTotals {

    /** Reported as the dominant category of a bucket with no time at all. */
    public static final String IDLE = "idle";

    private double productive;
    private double neutral;
    private double frivolity;
    private double draining;
    private double emergency;
    private double idle;

    public void add(ActivityCategory category, double activeSeconds, double idleSeconds) {
        addActive(category, activeSeconds);
        this.idle += idleSeconds;
    }

    public void addActive(ActivityCategory category, double activeSeconds) {
        if (category == null) {
            neutral += activeSeconds;
            return;
        }
        switch (category) {
            case PRODUCTIVE -> productive += activeSeconds;
            case FRIVOLITY -> frivolity += activeSeconds;
            case DRAINING -> draining += activeSeconds;
            case EMERGENCY -> emergency += activeSeconds;
            default -> neutral += activeSeconds;
        }
    }

    public void addIdle(double idleSeconds) {
        this.idle += idleSeconds;
    }

    public double productive() {
        return productive;
    }

    public double distraction() {
        return frivolity + draining;
    }

    public double idle() {
        return idle;
    }

    /**
     * Active seconds across all categories, idle excluded.
     */
    public double active() {
        return productive + neutral + frivolity + draining + emergency;
    }

    public boolean isEmpty() {
        return active() == 0.0 && idle == 0.0;
    }

    /**
     * Category with the most seconds. Ties go to the first in the order productive, neutral,
     * frivolity, draining, emergency, idle; an empty bucket reports {@value #IDLE}.
     */
    public String dominantCategory() {
        double[] values = {productive, neutral, frivolity, draining, emergency, idle};
        String[] names = {
            ActivityCategory.PRODUCTIVE.wireValue(),
            ActivityCategory.NEUTRAL.wireValue(),
            ActivityCategory.FRIVOLITY.wireValue(),
            ActivityCategory.DRAINING.wireValue(),
            ActivityCategory.EMERGENCY.wireValue(),
            IDLE
        };
        int best = -1;
        for (int i = 0; i < values.length; i++) {
            if (values[i] > 0 && (best < 0 || values[i] > values[best])) {
                best = i;
            }
        }
        return best < 0 ? IDLE : names[best];
    }

    /**
     * Active share of active plus idle time as a percentage, 0 when empty.
     */
    public int engagementPercent() {
        double active = active();
        double total = active + idle;
        return total > 0 ? (int) Math.round(active / total * 100.0) : 0;
    }

    public CategoryBreakdownDTO toDTO() {
        return new CategoryBreakdownDTO(
                Math.round(productive),
                Math.round(neutral),
                Math.round(frivolity),
                Math.round(draining),
                Math.round(emergency),
                Math.round(idle));
    }
}
