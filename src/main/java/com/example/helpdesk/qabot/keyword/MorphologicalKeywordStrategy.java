package com.example.helpdesk.qabot.keyword;

import com.example.helpdesk.qabot.model.Token;
import com.example.helpdesk.qabot.tokenizer.MorphologicalTokenizer;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps nouns and adjectives. Reads at most {@code maxTokens} tokens and returns at most
 * {@code maxKeywords} distinct keywords.
 */
public class MorphologicalKeywordStrategy implements KeywordStrategy {

    private static final Set<String> CONTENT_PARTS_OF_SPEECH = Set.of("名詞", "形容詞");

    private final MorphologicalTokenizer tokenizer;
    private final int maxTokens;
    private final int maxKeywords;

    public MorphologicalKeywordStrategy(MorphologicalTokenizer tokenizer, int maxTokens, int maxKeywords) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.maxTokens = maxTokens;
        this.maxKeywords = maxKeywords;
    }

    @Override
    public Set<String> extract(String sanitizedText) {
        Set<String> keywords = new LinkedHashSet<>();
        for (Token token : tokenizer.tokenize(sanitizedText, maxTokens)) {
            if (keywords.size() >= maxKeywords) {
                break;
            }
            String surface = token.surface();
            if (surface != null
                    && surface.length() > 1
                    && CONTENT_PARTS_OF_SPEECH.contains(token.partOfSpeech())) {
                keywords.add(surface);
            }
        }
        return keywords;
    }
}
