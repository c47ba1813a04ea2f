package com.llmcouncil.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Partial configuration update. {@code null} fields keep their current value; an empty
 * {@code default_reasoning_effort} disables the default reasoning parameter.
 */
public record CouncilConfigUpdate(
        @JsonProperty("council_models") List<String> councilModels,
        @JsonProperty("chairman_model") String chairmanModel,
        @JsonProperty("default_reasoning_effort") String defaultReasoningEffort,
        @JsonProperty("model_reasoning_config") Map<String, ReasoningSetting> modelReasoningConfig
) {

    public CouncilConfig applyTo(CouncilConfig current) {
        String effort = defaultReasoningEffort == null
                ? current.defaultReasoningEffort()
                : (defaultReasoningEffort.isBlank() ? null : defaultReasoningEffort);
        return new CouncilConfig(
                councilModels != null ? councilModels : current.councilModels(),
                chairmanModel != null ? chairmanModel : current.chairmanModel(),
                effort,
                modelReasoningConfig != null ? modelReasoningConfig : current.modelReasoningConfig());
    }
}
