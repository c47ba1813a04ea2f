package com.llmcouncil.council.service;

import static com.llmcouncil.council.CouncilConstants.DEFAULT_TITLE;
import static com.llmcouncil.council.CouncilConstants.MAX_TITLE_LENGTH;
import static com.llmcouncil.council.CouncilConstants.PURPOSE_TITLE;
import static com.llmcouncil.council.CouncilConstants.TITLE_PROMPT;

import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.TurnPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.concurrent.CompletableFuture;

/**
 * Names a conversation after its first question using a small, fast model.
 */
@Service
@Slf4j
public class TitleGenerator {

    private final FanOutCollector fanOutCollector;
    private final CouncilProperties properties;

    public TitleGenerator(FanOutCollector fanOutCollector, CouncilProperties properties) {
        this.fanOutCollector = fanOutCollector;
        this.properties = properties;
    }

    /**
     * Starts title generation in the background. The future always completes with a usable title.
     */
    public CompletableFuture<String> start(String question, CouncilConfig config) {
        String titleModel = StringUtils.hasText(properties.getTitleModel())
                ? properties.getTitleModel()
                : config.chairmanModel();
        return fanOutCollector
                .dispatch(PURPOSE_TITLE, titleModel, TurnPrompt.of(TITLE_PROMPT.formatted(question)),
                        config, properties.getTitleTimeout())
                .thenApply(this::toTitle);
    }

    private String toTitle(ModelReply reply) {
        if (reply.failed()) {
            log.warn("Title generation with {} failed: {}", reply.model(), reply.failureReason());
            return DEFAULT_TITLE;
        }
        return clean(reply.content());
    }

    static String clean(@Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            return DEFAULT_TITLE;
        }
        String title = raw.trim().lines().findFirst().orElse("").trim();
        title = title.replaceAll("^[\"'*#\\s]+|[\"'*\\s]+$", "");
        if (title.isEmpty()) {
            return DEFAULT_TITLE;
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH - 3) + "...";
        }
        return title;
    }
}
