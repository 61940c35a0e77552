package com.agentpipeline.common.aggregation;

import com.agentpipeline.common.matrix.AgeBand;
import com.agentpipeline.common.matrix.MatrixCell;
import com.agentpipeline.common.matrix.ScoreBand;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Record of one decision-matrix lookup: the inputs, the bands they fell into and the cell.
 */
public record MatrixEvaluation(
    @JsonProperty("effectiveAge") double effectiveAge,
    @JsonProperty("conditionScore") double conditionScore,
    @JsonProperty("ageBand") AgeBand ageBand,
    @JsonProperty("scoreBand") ScoreBand scoreBand,
    @JsonProperty("cell") MatrixCell cell
) {}
