package com.example.helpdesk.qabot.service;

import com.example.helpdesk.qabot.cache.ResourceLoadException;
import com.example.helpdesk.qabot.config.AnswerModelProperties;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a chat model against an OpenAI compatible endpoint. The default base URL is Gemini's
 * OpenAI compatible API.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiAnswerGeneratorFactory implements AnswerGeneratorFactory {

    private final AnswerModelProperties props;

    @Override
    public AnswerGenerator create() {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw ResourceLoadException.permanent("qa.answer.api-key is not set");
        }

        log.info("[answer-model] Building chat model '{}' at {}", props.getModelName(), props.getBaseUrl());
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .baseUrl(props.getBaseUrl())
                .apiKey(props.getApiKey())
                .modelName(props.getModelName())
                .temperature(props.getTemperature())
                .timeout(props.getTimeout())
                .build();
        return new LangChain4jAnswerGenerator(chatModel);
    }
}
