package com.example.helpdesk.qabot.model;

/**
 * Which cached resources are loaded right now. Taking a snapshot never triggers loading.
 */
public record ResourceStatus(
        boolean tokenizer,
        boolean model,
        boolean products,
        boolean faqs
) {
    public boolean ready() {
        return tokenizer && model && products && faqs;
    }
}
