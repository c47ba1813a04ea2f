package com.llmcouncil.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable council configuration. A running turn holds one instance for its whole lifetime,
 * so later updates never leak into it.
 */
public record CouncilConfig(
        @JsonProperty("council_models") List<String> councilModels,
        @JsonProperty("chairman_model") String chairmanModel,
        @JsonProperty("default_reasoning_effort") @Nullable String defaultReasoningEffort,
        @JsonProperty("model_reasoning_config") Map<String, ReasoningSetting> modelReasoningConfig
) {

    public CouncilConfig {
        councilModels = councilModels == null ? List.of() : List.copyOf(councilModels);
        modelReasoningConfig = modelReasoningConfig == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(modelReasoningConfig));
    }

    /**
     * Resolves the reasoning parameter to send with a call to {@code model}. An explicit
     * per-model entry wins, even when it disables reasoning.
     */
    @Nullable
    public ReasoningSetting reasoningFor(String model) {
        if (modelReasoningConfig.containsKey(model)) {
            ReasoningSetting setting = modelReasoningConfig.get(model);
            return setting != null && setting.enabled() ? setting : null;
        }
        if (StringUtils.hasText(defaultReasoningEffort)) {
            return new ReasoningSetting(ReasoningSetting.REASONING_EFFORT, defaultReasoningEffort);
        }
        return null;
    }

    public boolean isCouncilMember(String model) {
        return councilModels.contains(model);
    }

    /**
     * Rejects configurations a turn could not run with.
     *
     * @throws IllegalArgumentException when the council is empty or the chairman is not a member
     */
    public void validate() {
        if (councilModels.isEmpty()) {
            throw new IllegalArgumentException("council_models cannot be empty");
        }
        if (councilModels.stream().anyMatch(model -> !StringUtils.hasText(model))) {
            throw new IllegalArgumentException("council_models cannot contain blank identifiers");
        }
        if (councilModels.stream().distinct().count() != councilModels.size()) {
            throw new IllegalArgumentException("council_models cannot contain duplicates");
        }
        if (!StringUtils.hasText(chairmanModel)) {
            throw new IllegalArgumentException("chairman_model must be set");
        }
        if (!isCouncilMember(chairmanModel)) {
            throw new IllegalArgumentException("chairman_model must be one of the council_models");
        }
    }
}
