package com.agentpipeline.common.matrix;

import com.agentpipeline.common.exception.InputContractViolationException;

/**
 * Effective-age bands in years forming the rows of the {@link DecisionMatrix}.
 *
 * <p>Bands are closed on the upper bound: an effective age of exactly 5 is {@link #NEW}.
 * Negative ages fall into the first band, ages above 50 into the last.
 */
public enum AgeBand {
    NEW(5, 1),
    RECENT(15, 2),
    ESTABLISHED(30, 3),
    AGED(50, 4),
    HISTORIC(Double.POSITIVE_INFINITY, 5);

    private final double upperBound;
    private final int category;

    AgeBand(double upperBound, int category) {
        this.upperBound = upperBound;
        this.category = category;
    }

    /** Age-only category of the band, 1 (newest) to 5 (oldest). */
    public int category() {
        return category;
    }

    public double upperBound() {
        return upperBound;
    }

    public static AgeBand of(double effectiveAge) {
        if (Double.isNaN(effectiveAge)) {
            throw new InputContractViolationException("Effective age must be a number, got NaN");
        }
        for (AgeBand band : values()) {
            if (effectiveAge <= band.upperBound) {
                return band;
            }
        }
        return HISTORIC;
    }
}
