package com.agentpipeline.common.matrix;

/**
 * How well the age and condition evidence agree for one matrix cell.
 * Only {@link #CONFLICT} contributes to the warning tally.
 */
public enum Agreement {
    MATCH(0),
    CAUTION(0),
    CONFLICT(1);

    private final int warningPenalty;

    Agreement(int warningPenalty) {
        this.warningPenalty = warningPenalty;
    }

    public int warningPenalty() {
        return warningPenalty;
    }
}
