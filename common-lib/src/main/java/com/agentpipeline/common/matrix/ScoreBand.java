package com.agentpipeline.common.matrix;

import com.agentpipeline.common.exception.InputContractViolationException;

/**
 * Condition-score bands on the 0–30 scale forming the columns of the {@link DecisionMatrix}.
 *
 * <p>The score is truncated to whole points before bucketing, so 7.9 still counts as 7.
 * Scores below zero fall into {@link #CRITICAL}, scores above 30 into {@link #EXCELLENT}.
 */
public enum ScoreBand {
    EXCELLENT(27, "27-30"),
    GOOD(22, "22-26"),
    FAIR(16, "16-21"),
    POOR(8, "8-15"),
    CRITICAL(Integer.MIN_VALUE, "0-7");

    private final int lowerBound;
    private final String label;

    ScoreBand(int lowerBound, String label) {
        this.lowerBound = lowerBound;
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ScoreBand of(double score) {
        if (Double.isNaN(score)) {
            throw new InputContractViolationException("Condition score must be a number, got NaN");
        }
        double points = Math.floor(score);
        for (ScoreBand band : values()) {
            if (points >= band.lowerBound) {
                return band;
            }
        }
        return CRITICAL;
    }
}
