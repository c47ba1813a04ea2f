package com.llmcouncil.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CouncilClientConfig {

    @Bean
    public ChatClient councilChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor(CouncilProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerConcurrency()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool();
    }
}
