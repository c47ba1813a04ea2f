package com.llmcouncil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LlmCouncilApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmCouncilApplication.class, args);
    }
}
