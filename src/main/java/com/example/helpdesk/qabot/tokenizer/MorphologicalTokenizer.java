package com.example.helpdesk.qabot.tokenizer;

import com.example.helpdesk.qabot.model.Token;

import java.util.List;

/**
 * Splits text into part-of-speech tagged tokens.
 */
@FunctionalInterface
public interface MorphologicalTokenizer {

    /**
     * @param text      text to analyze
     * @param maxTokens analysis stops once this many tokens have been produced
     */
    List<Token> tokenize(String text, int maxTokens);
}
