package com.llmcouncil.council.service;

import com.llmcouncil.council.model.LabelMapping;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RankingParserTest {

    private final RankingParser parser = new RankingParser();
    private final LabelMapping mapping = mapping("openai/gpt-5.2", "google/gemini-3-pro-preview", "anthropic/claude-opus-4.5");

    private static LabelMapping mapping(String... models) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < models.length; i++) {
            labels.put(AnonymizationService.labelFor(i), models[i]);
        }
        return new LabelMapping(labels);
    }

    @Test
    void testNumberedListAfterHeader() {
        String text = """
                Response A is thorough but verbose. Response B misses the point.
                Response C is concise.

                FINAL RANKING:
                1. Response C
                2. Response A
                3. Response B
                """;
        assertEquals(List.of("Response C", "Response A", "Response B"), parser.parse(text, mapping));
    }

    @Test
    void testListEntriesWithDecoration() {
        String text = """
                FINAL RANKING:
                1) **Response B** - clearest explanation
                2) **Response A**
                - Response C
                """;
        assertEquals(List.of("Response B", "Response A", "Response C"), parser.parse(text, mapping));
    }

    @Test
    void testLastHeaderWins() {
        String text = """
                I will end with a FINAL RANKING: section as asked.
                Response A is fine.

                Final Ranking:
                1. Response B
                2. Response A
                """;
        assertEquals(List.of("Response B", "Response A"), parser.parse(text, mapping));
    }

    @Test
    void testInlineMentionsAfterHeader() {
        String text = "Response C is weakest overall. FINAL RANKING: Response B > Response A > Response C";
        assertEquals(List.of("Response B", "Response A", "Response C"), parser.parse(text, mapping));
    }

    @Test
    void testFallsBackToMentionsAnywhere() {
        String text = "Response B is better than Response A, which beats Response C.";
        assertEquals(List.of("Response B", "Response A", "Response C"), parser.parse(text, mapping));
    }

    @Test
    void testDropsUnknownLabelsAndDuplicates() {
        String text = """
                FINAL RANKING:
                1. Response D
                2. Response B
                3. Response B
                4. Response A
                """;
        assertEquals(List.of("Response B", "Response A"), parser.parse(text, mapping));
    }

    @Test
    void testNothingUsable() {
        assertTrue(parser.parse(null, mapping).isEmpty());
        assertTrue(parser.parse("   ", mapping).isEmpty());
        assertTrue(parser.parse("All answers are equally good.", mapping).isEmpty());
        assertTrue(parser.parse("FINAL RANKING:\n1. Response A", LabelMapping.empty()).isEmpty());
    }
}
