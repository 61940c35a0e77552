package com.agentpipeline.common.matrix;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.agentpipeline.common.matrix.Agreement.CAUTION;
import static com.agentpipeline.common.matrix.Agreement.CONFLICT;
import static com.agentpipeline.common.matrix.Agreement.MATCH;

/**
 * Fixed lookup table combining effective age (rows) and condition score (columns) into a
 * property category and an {@link Agreement} level.
 *
 * <h3>Standard table</h3>
 * <pre>
 *   age \ score   27-30   22-26   16-21   8-15    0-7
 *   0-5           1 M     2 C     3 X     4 X     5 X
 *   6-15          1 C     2 M     3 C     4 X     5 X
 *   16-30         2 X     2 C     3 M     4 C     5 X
 *   31-50         2 X     3 C     3 C     4 M     5 M
 *   51+           3 X     3 X     3 C     4 M     5 M
 *   (M = MATCH, C = CAUTION, X = CONFLICT)
 * </pre>
 *
 * <p>Pure and thread-safe. The table is validated to cover every band pair on construction,
 * so {@link #lookup(double, double)} is total over non-NaN inputs.
 */
public final class DecisionMatrix {

    private static final DecisionMatrix STANDARD = buildStandard();

    private final Map<AgeBand, Map<ScoreBand, MatrixCell>> cells;
    private final int worstCategory;

    public DecisionMatrix(Map<AgeBand, Map<ScoreBand, MatrixCell>> table) {
        EnumMap<AgeBand, Map<ScoreBand, MatrixCell>> copy = new EnumMap<>(AgeBand.class);
        int worst = Integer.MIN_VALUE;
        for (AgeBand age : AgeBand.values()) {
            Map<ScoreBand, MatrixCell> row = table.get(age);
            if (row == null) {
                throw new IllegalArgumentException("Decision matrix is missing age band " + age);
            }
            EnumMap<ScoreBand, MatrixCell> rowCopy = new EnumMap<>(ScoreBand.class);
            for (ScoreBand score : ScoreBand.values()) {
                MatrixCell cell = row.get(score);
                if (cell == null) {
                    throw new IllegalArgumentException(
                        "Decision matrix is missing cell " + age + "/" + score);
                }
                rowCopy.put(score, cell);
                worst = Math.max(worst, cell.category());
            }
            copy.put(age, Collections.unmodifiableMap(rowCopy));
        }
        this.cells = Collections.unmodifiableMap(copy);
        this.worstCategory = worst;
    }

    public static DecisionMatrix standard() {
        return STANDARD;
    }

    /**
     * @throws com.agentpipeline.common.exception.InputContractViolationException if either
     *         value is NaN
     */
    public MatrixCell lookup(double effectiveAge, double conditionScore) {
        return lookup(AgeBand.of(effectiveAge), ScoreBand.of(conditionScore));
    }

    public MatrixCell lookup(AgeBand age, ScoreBand score) {
        return cells.get(age).get(score);
    }

    /** Highest (worst) category present anywhere in the table. */
    public int worstCategory() {
        return worstCategory;
    }

    private static DecisionMatrix buildStandard() {
        Map<AgeBand, Map<ScoreBand, MatrixCell>> table = new EnumMap<>(AgeBand.class);
        table.put(AgeBand.NEW,         row(1, MATCH,    2, CAUTION,  3, CONFLICT, 4, CONFLICT, 5, CONFLICT));
        table.put(AgeBand.RECENT,      row(1, CAUTION,  2, MATCH,    3, CAUTION,  4, CONFLICT, 5, CONFLICT));
        table.put(AgeBand.ESTABLISHED, row(2, CONFLICT, 2, CAUTION,  3, MATCH,    4, CAUTION,  5, CONFLICT));
        table.put(AgeBand.AGED,        row(2, CONFLICT, 3, CAUTION,  3, CAUTION,  4, MATCH,    5, MATCH));
        table.put(AgeBand.HISTORIC,    row(3, CONFLICT, 3, CONFLICT, 3, CAUTION,  4, MATCH,    5, MATCH));
        return new DecisionMatrix(table);
    }

    private static Map<ScoreBand, MatrixCell> row(int c1, Agreement a1, int c2, Agreement a2,
                                                  int c3, Agreement a3, int c4, Agreement a4,
                                                  int c5, Agreement a5) {
        Map<ScoreBand, MatrixCell> row = new EnumMap<>(ScoreBand.class);
        row.put(ScoreBand.EXCELLENT, MatrixCell.of(c1, a1));
        row.put(ScoreBand.GOOD,      MatrixCell.of(c2, a2));
        row.put(ScoreBand.FAIR,      MatrixCell.of(c3, a3));
        row.put(ScoreBand.POOR,      MatrixCell.of(c4, a4));
        row.put(ScoreBand.CRITICAL,  MatrixCell.of(c5, a5));
        return row;
    }
}
