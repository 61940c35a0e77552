package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Technical-condition assessment produced outside the pipeline (visual inspection).
 *
 * @param score   condition score on the 0–30 scale, higher is better
 * @param defects observed defects, possibly empty
 */
public record ConditionReport(
    @JsonProperty("score") double score,
    @JsonProperty("defects") List<Defect> defects
) {
    public ConditionReport {
        defects = defects == null ? List.of() : List.copyOf(defects);
    }
}
