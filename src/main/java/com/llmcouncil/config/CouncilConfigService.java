package com.llmcouncil.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide council configuration. Readers take a snapshot reference; writers replace the
 * whole value under a lock, so a turn never observes a half-applied update.
 */
@Service
@Slf4j
public class CouncilConfigService {

    private final ObjectMapper objectMapper;
    private final Path configFile;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile CouncilConfig current;

    public CouncilConfigService(CouncilProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.configFile = StringUtils.hasText(properties.getConfigFile())
                ? Paths.get(properties.getConfigFile())
                : null;
        this.current = loadInitial(properties.toCouncilConfig());
    }

    public CouncilConfig currentCouncilConfig() {
        return current;
    }

    public CouncilConfig update(CouncilConfigUpdate update) {
        writeLock.lock();
        try {
            CouncilConfig next = update.applyTo(current);
            next.validate();
            save(next);
            current = next;
            log.info("Council configuration updated: models={}, chairman={}.",
                    next.councilModels(), next.chairmanModel());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    private CouncilConfig loadInitial(CouncilConfig defaults) {
        if (configFile == null || !Files.exists(configFile)) {
            return defaults;
        }
        try {
            CouncilConfigUpdate stored = objectMapper.readValue(configFile.toFile(), CouncilConfigUpdate.class);
            CouncilConfig merged = stored.applyTo(defaults);
            merged.validate();
            log.info("Loaded council configuration from {}.", configFile);
            return merged;
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Failed to load council configuration from {}: {}. Using defaults.", configFile, ex.getMessage());
            return defaults;
        }
    }

    private void save(CouncilConfig config) {
        if (configFile == null) {
            return;
        }
        try {
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), config);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save council configuration to " + configFile, ex);
        }
    }
}
