package com.llmcouncil.council.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.FinalAnswer;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;

import java.util.List;

/**
 * Typed progress events of one council turn, in the order the orchestrator emits them.
 * Arrival events of a stage may interleave arbitrarily; the stage's completion event always
 * follows every arrival of that stage.
 */
public interface CouncilEvent {

    String STAGE1_START = "stage1_start";
    String STAGE1_RESPONSE = "stage1_response";
    String STAGE1_COMPLETE = "stage1_complete";
    String STAGE2_START = "stage2_start";
    String STAGE2_RESPONSE = "stage2_response";
    String STAGE2_COMPLETE = "stage2_complete";
    String STAGE3_START = "stage3_start";
    String STAGE3_COMPLETE = "stage3_complete";
    String TITLE_COMPLETE = "title_complete";
    String COMPLETE = "complete";
    String ERROR = "error";
    String CANCELLED = "cancelled";

    String type();

    /**
     * Whether no further events may follow this one for the same turn.
     */
    default boolean terminal() {
        return false;
    }

    record Stage1Start(List<String> models) implements CouncilEvent {
        public Stage1Start {
            models = List.copyOf(models);
        }

        @Override
        public String type() {
            return STAGE1_START;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    record Stage1Response(String model, String response, boolean failed) implements CouncilEvent {

        public static Stage1Response of(Stage1Answer answer) {
            return new Stage1Response(answer.model(), answer.response(), false);
        }

        public static Stage1Response failure(String model) {
            return new Stage1Response(model, null, true);
        }

        @Override
        public String type() {
            return STAGE1_RESPONSE;
        }
    }

    record Stage1Complete(List<Stage1Answer> data) implements CouncilEvent {
        public Stage1Complete {
            data = List.copyOf(data);
        }

        @Override
        public String type() {
            return STAGE1_COMPLETE;
        }
    }

    record Stage2Start(List<String> models, CouncilMetadata metadata) implements CouncilEvent {
        public Stage2Start {
            models = List.copyOf(models);
        }

        @Override
        public String type() {
            return STAGE2_START;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    record Stage2Response(
            @JsonProperty("model") String model,
            @JsonProperty("ranking") String ranking,
            @JsonProperty("parsed_ranking") List<String> parsedRanking,
            @JsonProperty("failed") boolean failed
    ) implements CouncilEvent {

        public static Stage2Response of(Stage2Critique critique) {
            return new Stage2Response(critique.model(), critique.ranking(), critique.parsedRanking(), false);
        }

        public static Stage2Response failure(String model) {
            return new Stage2Response(model, null, null, true);
        }

        @Override
        public String type() {
            return STAGE2_RESPONSE;
        }
    }

    record Stage2Complete(List<Stage2Critique> data, CouncilMetadata metadata) implements CouncilEvent {
        public Stage2Complete {
            data = List.copyOf(data);
        }

        @Override
        public String type() {
            return STAGE2_COMPLETE;
        }
    }

    record Stage3Start() implements CouncilEvent {
        @Override
        public String type() {
            return STAGE3_START;
        }
    }

    record Stage3Complete(FinalAnswer data) implements CouncilEvent {
        @Override
        public String type() {
            return STAGE3_COMPLETE;
        }
    }

    record TitleComplete(String title) implements CouncilEvent {
        @Override
        public String type() {
            return TITLE_COMPLETE;
        }
    }

    record TurnComplete() implements CouncilEvent {
        @Override
        public String type() {
            return COMPLETE;
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    record TurnError(String message) implements CouncilEvent {
        @Override
        public String type() {
            return ERROR;
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    record TurnCancelled() implements CouncilEvent {
        @Override
        public String type() {
            return CANCELLED;
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }
}
