package com.example.helpdesk.qabot.service;

import dev.langchain4j.model.chat.ChatModel;

import java.util.Objects;

public class LangChain4jAnswerGenerator implements AnswerGenerator {

    private final ChatModel chatModel;

    public LangChain4jAnswerGenerator(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    public String generate(String prompt) {
        return chatModel.chat(prompt);
    }
}
