package com.llmcouncil.api;

import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.config.CouncilConfigService;
import com.llmcouncil.config.CouncilConfigUpdate;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/config")
public class ConfigController {

    private final CouncilConfigService configService;

    public ConfigController(CouncilConfigService configService) {
        this.configService = configService;
    }

    @GetMapping
    public CouncilConfig getConfig() {
        return configService.currentCouncilConfig();
    }

    /**
     * Applies a partial update. Turns already running keep the configuration they started with.
     */
    @PutMapping
    public CouncilConfig updateConfig(@RequestBody CouncilConfigUpdate update) {
        try {
            return configService.update(update);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
