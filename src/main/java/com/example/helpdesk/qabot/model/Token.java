package com.example.helpdesk.qabot.model;

/**
 * A token emitted by a morphological tokenizer.
 *
 * @param surface      the text as it appears in the input
 * @param partOfSpeech the coarse part of speech, e.g. {@code 名詞}
 */
public record Token(String surface, String partOfSpeech) {
}
