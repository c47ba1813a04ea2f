package com.llmcouncil.conversation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.Stage2Critique;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final JsonProcessingService service = new JsonProcessingService(new ObjectMapper());

    @Test
    void testWritesWireNames() {
        String json = service.toJson(new Stage2Critique("p/m1", "text", List.of("Response A")));
        assertTrue(json.contains("\"parsed_ranking\":[\"Response A\"]"));
        assertFalse(json.contains("parsed\""));
    }

    @Test
    void testMetadataLabelMapIsPlainObject() {
        CouncilMetadata metadata = new CouncilMetadata(new LabelMapping(Map.of("Response A", "p/m1")), List.of());
        String json = service.toJson(metadata);
        assertTrue(json.contains("\"label_to_model\":{\"Response A\":\"p/m1\"}"));

        CouncilMetadata read = service.fromJson("metadata", json, new TypeReference<>() {
        });
        assertEquals(metadata, read);
    }

    @Test
    void testLabelsOnlyMetadataOmitsAggregate() {
        String json = service.toJson(CouncilMetadata.labelsOnly(LabelMapping.empty()));
        assertFalse(json.contains("aggregate_rankings"));
    }

    @Test
    void testUnreadableInputGivesNull() {
        assertNull(service.fromJson("x", "", new TypeReference<List<String>>() {
        }));
        assertNull(service.fromJson("x", "{broken", new TypeReference<List<String>>() {
        }));
        assertNull(service.toJson(null));
    }
}
