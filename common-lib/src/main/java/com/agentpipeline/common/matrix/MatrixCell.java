package com.agentpipeline.common.matrix;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MatrixCell(
    @JsonProperty("category") int category,
    @JsonProperty("agreement") Agreement agreement
) {
    public static MatrixCell of(int category, Agreement agreement) {
        return new MatrixCell(category, agreement);
    }
}
