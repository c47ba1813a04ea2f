package com.llmcouncil.council;

import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.council.model.TurnPrompt;
import org.springframework.lang.Nullable;

/**
 * Everything a stage needs about the running turn. The configuration is the snapshot taken
 * when the turn started.
 */
public record TurnContext(
        @Nullable String runId,
        CouncilConfig config,
        TurnPrompt prompt
) {

    public String question() {
        return prompt.question();
    }
}
