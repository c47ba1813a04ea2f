package com.llmcouncil.council.service;

import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.config.ReasoningSetting;
import com.llmcouncil.council.api.ModelInvocationService;
import com.llmcouncil.council.model.HistoryEntry;
import com.llmcouncil.council.model.ImageAttachment;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.TurnPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.content.Media;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeTypeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Calls council members through the OpenAI-compatible OpenRouter endpoint configured for
 * Spring AI ({@code spring.ai.openai.base-url}). The model id and reasoning effort travel as
 * per-call options so one client serves every member.
 */
@Service
@Slf4j
public class OpenRouterModelInvocationService implements ModelInvocationService {

    private final ChatClient chatClient;

    public OpenRouterModelInvocationService(ChatClient councilChatClient) {
        this.chatClient = councilChatClient;
    }

    @Override
    public ModelReply invoke(String model, TurnPrompt prompt, CouncilConfig config) {
        try {
            String content = chatClient.prompt()
                    .messages(buildMessages(prompt))
                    .options(buildOptions(model, config.reasoningFor(model)))
                    .call()
                    .content();
            return ModelReply.success(model, content);
        } catch (Exception ex) {
            log.debug("Invocation of {} failed", model, ex);
            return ModelReply.failure(model, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    List<Message> buildMessages(TurnPrompt prompt) {
        List<Message> messages = new ArrayList<>(prompt.history().size() + 1);
        for (HistoryEntry entry : prompt.history()) {
            if (entry.role() == HistoryEntry.Role.ASSISTANT) {
                messages.add(new AssistantMessage(entry.content()));
            } else {
                messages.add(new UserMessage(entry.content()));
            }
        }
        List<Media> media = new ArrayList<>(prompt.images().size());
        for (ImageAttachment image : prompt.images()) {
            media.add(Media.builder()
                    .mimeType(MimeTypeUtils.parseMimeType(image.mimeType()))
                    .data(new ByteArrayResource(image.data()))
                    .build());
        }
        messages.add(UserMessage.builder()
                .text(prompt.question())
                .media(media)
                .build());
        return messages;
    }

    OpenAiChatOptions buildOptions(String model, @Nullable ReasoningSetting reasoning) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder().model(model);
        if (reasoning != null) {
            if (ReasoningSetting.REASONING_EFFORT.equals(reasoning.paramName())
                    && reasoning.value() instanceof String effort) {
                builder.reasoningEffort(effort);
            } else {
                log.debug("Reasoning parameter {} is not supported for {}; sending without it.",
                        reasoning.paramName(), model);
            }
        }
        return builder.build();
    }
}
