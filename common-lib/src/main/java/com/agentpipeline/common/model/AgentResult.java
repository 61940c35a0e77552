package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one agent execution.
 *
 * <p>A failed execution is an ordinary value with {@link AgentStatus#FAIL}, never an exception.
 * {@code category} and {@code score} are optional; {@code details} keeps insertion order.
 */
public record AgentResult(
    @JsonProperty("status") AgentStatus status,
    @JsonProperty("category") Integer category,
    @JsonProperty("score") Double score,
    @JsonProperty("summary") String summary,
    @JsonProperty("details") Map<String, Object> details,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("errors") List<String> errors
) {
    public static final String ERROR_SUMMARY_PREFIX = "Agent error: ";

    public AgentResult {
        if (status == null) {
            throw new IllegalArgumentException("AgentResult status must not be null");
        }
        summary = summary == null ? "" : summary;
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Result synthesized for an agent whose body raised an error.
     * Summary is {@code "Agent error: <message>"}, errors holds the message alone.
     */
    public static AgentResult failure(String message) {
        String text = message == null ? "unknown error" : message;
        return new AgentResult(AgentStatus.FAIL, null, null,
            ERROR_SUMMARY_PREFIX + text, Map.of(), List.of(), List.of(text));
    }

    public static AgentResult failure(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return failure(message);
    }

    public static Builder builder(AgentStatus status) {
        return new Builder(status);
    }

    public boolean isFailed() {
        return status == AgentStatus.FAIL;
    }

    public Object detail(String key) {
        return details.get(key);
    }

    public boolean flag(String key) {
        return Boolean.TRUE.equals(details.get(key));
    }

    public static final class Builder {
        private AgentStatus status;
        private Integer category;
        private Double score;
        private String summary;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        private Builder(AgentStatus status) {
            this.status = status;
        }

        public Builder status(AgentStatus status) {
            this.status = status;
            return this;
        }

        public Builder category(Integer category) {
            this.category = category;
            return this;
        }

        public Builder score(Double score) {
            this.score = score;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder detail(String key, Object value) {
            details.put(key, value);
            return this;
        }

        public Builder warning(String warning) {
            warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder error(String error) {
            errors.add(error);
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors.addAll(errors);
            return this;
        }

        /** Derives the status from collected findings: FAIL on errors, WARN on warnings. */
        public Builder statusFromFindings() {
            if (!errors.isEmpty()) {
                status = AgentStatus.FAIL;
            } else if (!warnings.isEmpty()) {
                status = AgentStatus.WARN;
            } else {
                status = AgentStatus.SUCCESS;
            }
            return this;
        }

        public AgentResult build() {
            return new AgentResult(status, category, score, summary, details, warnings, errors);
        }
    }
}
