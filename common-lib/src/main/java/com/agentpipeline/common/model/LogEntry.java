package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LogEntry(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("message") String message,
    @JsonProperty("level") LogLevel level
) {
    public static LogEntry of(String message, LogLevel level) {
        return new LogEntry(Instant.now(), message, level);
    }
}
