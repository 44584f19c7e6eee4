package com.example.helpdesk.qabot.model;

public enum ResourceKind {
    PRODUCTS("products"),
    FAQS("faqs"),
    TOKENIZER("tokenizer"),
    ANSWER_GENERATOR("model");

    private final String label;

    ResourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
