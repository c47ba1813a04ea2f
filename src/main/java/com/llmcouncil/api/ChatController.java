package com.llmcouncil.api;

import com.llmcouncil.stream.CouncilStreamService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final CouncilStreamService streamService;

    public ChatController(CouncilStreamService streamService) {
        this.streamService = streamService;
    }

    @PostMapping("/cancel/{runId}")
    public CancelRunResponse cancelStream(@PathVariable String runId) {
        boolean cancelled = streamService.cancelRun(runId);
        return cancelled ? CancelRunResponse.success() : CancelRunResponse.notFound();
    }
}
