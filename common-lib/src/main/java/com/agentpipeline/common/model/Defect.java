package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Defect(
    @JsonProperty("description") String description,
    @JsonProperty("severity") DefectSeverity severity
) {}
