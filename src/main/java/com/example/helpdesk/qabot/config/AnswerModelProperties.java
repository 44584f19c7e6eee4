package com.example.helpdesk.qabot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties:
 *
 * qa.answer.api-key=...
 * qa.answer.base-url=https://generativelanguage.googleapis.com/v1beta/openai/
 * qa.answer.model-name=gemini-2.5-pro
 * qa.answer.temperature=0.3
 */
@Data
@ConfigurationProperties(prefix = "qa.answer")
public class AnswerModelProperties {

    /**
     * API key of the OpenAI compatible endpoint. Blank disables answer generation until restart.
     */
    private String apiKey;

    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";

    private String modelName = "gemini-2.5-pro";

    private double temperature = 0.3;

    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Ranked items rendered into the prompt context.
     */
    private int maxContextItems = 8;
}
