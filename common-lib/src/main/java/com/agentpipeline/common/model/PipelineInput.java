package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable input bundle shared read-only by every agent of a pipeline run.
 *
 * <p>Only {@code images} is mandatory; every other field may be {@code null} and the agent
 * that needs it degrades to a warning or failure of its own.
 */
public record PipelineInput(
    @JsonProperty("images") List<ImageDescriptor> images,
    @JsonProperty("yearBuilt") Integer yearBuilt,
    @JsonProperty("yearReconstructed") Integer yearReconstructed,
    @JsonProperty("propertyAddress") String propertyAddress,
    @JsonProperty("propertyLatitude") Double propertyLatitude,
    @JsonProperty("propertyLongitude") Double propertyLongitude,
    @JsonProperty("conditionReport") ConditionReport conditionReport,
    @JsonProperty("attributes") Map<String, Object> attributes
) {
    public PipelineInput {
        images = images == null ? List.of() : List.copyOf(images);
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean hasPropertyLocation() {
        return propertyLatitude != null && propertyLongitude != null;
    }
}
