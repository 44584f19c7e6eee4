package com.example.helpdesk.qabot.keyword;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fallback used while no morphological tokenizer is available: whitespace split, edge
 * punctuation stripped, particles and single characters dropped.
 */
public class WhitespaceKeywordStrategy implements KeywordStrategy {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u3000]+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{P}\\p{S}]+|[\\p{P}\\p{S}]+$");

    static final Set<String> STOP_WORDS = Set.of(
            "の", "は", "が", "を", "に", "へ", "と", "で", "も", "や", "か", "な", "ね", "よ",
            "から", "まで", "より", "など", "って", "です", "ます", "でしょう", "ください");

    @Override
    public Set<String> extract(String sanitizedText) {
        Set<String> keywords = new LinkedHashSet<>();
        if (sanitizedText == null || sanitizedText.isBlank()) {
            return keywords;
        }
        for (String word : WHITESPACE.split(sanitizedText.strip())) {
            String cleaned = EDGE_PUNCTUATION.matcher(word).replaceAll("");
            if (cleaned.length() > 1 && !STOP_WORDS.contains(cleaned)) {
                keywords.add(cleaned);
            }
        }
        return keywords;
    }
}
