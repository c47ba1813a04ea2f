package com.llmcouncil.council.api;

import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.TurnPrompt;

/**
 * The only capability the council needs from a model provider. Implementations report
 * transport and provider errors as a failed {@link ModelReply} instead of throwing; callers
 * bound the call with their own timeout.
 */
public interface ModelInvocationService {

    /**
     * Sends {@code prompt} to {@code model}.
     *
     * @param model  provider model identifier, e.g. {@code openai/gpt-5.2}
     * @param prompt history, question and images for this call
     * @param config the turn's configuration snapshot, used for per-model reasoning settings
     * @return the reply text or a failure
     */
    ModelReply invoke(String model, TurnPrompt prompt, CouncilConfig config);
}
