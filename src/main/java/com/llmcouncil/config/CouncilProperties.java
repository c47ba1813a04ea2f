package com.llmcouncil.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "council")
public class CouncilProperties {

    private List<String> models = new ArrayList<>(List.of(
            "openai/gpt-5.2",
            "google/gemini-3-pro-preview",
            "anthropic/claude-opus-4.5",
            "deepseek/deepseek-v3.2"));
    private String chairmanModel = "openai/gpt-5.2";
    private String defaultReasoningEffort = "medium";
    private Map<String, ReasoningSetting> modelReasoning = new HashMap<>(
            Map.of("openai/gpt-5.2", new ReasoningSetting(ReasoningSetting.REASONING_EFFORT, "high")));
    private String titleModel = "google/gemini-2.5-flash";
    private Duration modelTimeout = Duration.ofSeconds(120);
    private Duration titleTimeout = Duration.ofSeconds(30);
    private int workerConcurrency = 8;
    private int maxImages = 4;
    private long maxImageBytes = 5L * 1024 * 1024;
    private String configFile;

    public List<String> getModels() {
        return models;
    }

    public void setModels(List<String> models) {
        if (models == null) {
            return;
        }
        this.models = new ArrayList<>(models);
    }

    public String getChairmanModel() {
        return chairmanModel;
    }

    public void setChairmanModel(String chairmanModel) {
        this.chairmanModel = chairmanModel;
    }

    public String getDefaultReasoningEffort() {
        return defaultReasoningEffort;
    }

    public void setDefaultReasoningEffort(String defaultReasoningEffort) {
        this.defaultReasoningEffort = defaultReasoningEffort;
    }

    public Map<String, ReasoningSetting> getModelReasoning() {
        return modelReasoning;
    }

    public void setModelReasoning(Map<String, ReasoningSetting> modelReasoning) {
        if (modelReasoning == null) {
            return;
        }
        this.modelReasoning = new HashMap<>(modelReasoning);
    }

    public String getTitleModel() {
        return titleModel;
    }

    public void setTitleModel(String titleModel) {
        this.titleModel = titleModel;
    }

    public Duration getModelTimeout() {
        return modelTimeout;
    }

    public void setModelTimeout(Duration modelTimeout) {
        this.modelTimeout = modelTimeout;
    }

    public Duration getTitleTimeout() {
        return titleTimeout;
    }

    public void setTitleTimeout(Duration titleTimeout) {
        this.titleTimeout = titleTimeout;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public int getMaxImages() {
        return maxImages;
    }

    public void setMaxImages(int maxImages) {
        this.maxImages = maxImages;
    }

    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(long maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    /**
     * Builds the initial council configuration from the bound properties.
     */
    public CouncilConfig toCouncilConfig() {
        return new CouncilConfig(models, chairmanModel, defaultReasoningEffort, modelReasoning);
    }
}
