package com.llmcouncil.council.service;

import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.council.CouncilConstants;
import com.llmcouncil.council.model.ModelReply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class TitleGeneratorTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final CouncilProperties properties = new CouncilProperties();
    private final CouncilConfig config = new CouncilConfig(List.of("p/m1"), "p/m1", null, Map.of());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testClean() {
        assertEquals("Quantum Computing Basics", TitleGenerator.clean("\"Quantum Computing Basics\"\n"));
        assertEquals("Rust Lifetimes", TitleGenerator.clean("## **Rust Lifetimes**\nextra line"));
        assertEquals(CouncilConstants.DEFAULT_TITLE, TitleGenerator.clean("  "));
        assertEquals(CouncilConstants.DEFAULT_TITLE, TitleGenerator.clean("\"\""));
        String longTitle = TitleGenerator.clean("A".repeat(80));
        assertEquals(CouncilConstants.MAX_TITLE_LENGTH, longTitle.length());
        assertTrue(longTitle.endsWith("..."));
    }

    @Test
    void testUsesTitleModel() throws Exception {
        properties.setTitleModel("p/fast");
        FanOutCollector fanOut = new FanOutCollector((model, prompt, cfg) -> ModelReply.success(model, model),
                executor, new CouncilMetricsService());

        assertEquals("p/fast", new TitleGenerator(fanOut, properties).start("question", config).get());
    }

    @Test
    void testFailureFallsBackToDefault() throws Exception {
        properties.setTitleTimeout(Duration.ofSeconds(1));
        FanOutCollector fanOut = new FanOutCollector((model, prompt, cfg) -> {
            throw new IllegalStateException("down");
        }, executor, new CouncilMetricsService());

        assertEquals(CouncilConstants.DEFAULT_TITLE, new TitleGenerator(fanOut, properties).start("question", config).get());
    }
}
