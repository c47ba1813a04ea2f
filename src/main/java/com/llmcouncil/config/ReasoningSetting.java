package com.llmcouncil.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-model reasoning parameter. A {@code null} value disables reasoning for the model.
 */
public record ReasoningSetting(
        @JsonProperty("param_name") String paramName,
        @JsonProperty("value") Object value
) {
    public static final String REASONING_EFFORT = "reasoning_effort";

    public boolean enabled() {
        return paramName != null && value != null;
    }
}
