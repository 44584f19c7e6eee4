package com.example.helpdesk.qabot.keyword;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.config.QaProperties;
import com.example.helpdesk.qabot.validation.MarkupEscapeValidator;
import com.example.helpdesk.qabot.validation.TextSanitizer;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Extracts the keywords a question is scored with. Uses the morphological tokenizer when the
 * cache can supply one and the whitespace fallback otherwise.
 */
@Slf4j
public class KeywordExtractor {

    private final TextSanitizer sanitizer;
    private final ResourceCache resourceCache;
    private final KeywordStrategy fallback;
    private final int maxTokens;
    private final int maxKeywords;

    public KeywordExtractor(TextSanitizer sanitizer, ResourceCache resourceCache, QaProperties.Keywords limits) {
        this(sanitizer, resourceCache, new WhitespaceKeywordStrategy(), limits.getMaxTokens(), limits.getMaxKeywords());
    }

    public KeywordExtractor(TextSanitizer sanitizer,
                            ResourceCache resourceCache,
                            KeywordStrategy fallback,
                            int maxTokens,
                            int maxKeywords) {
        this.sanitizer = sanitizer;
        this.resourceCache = resourceCache;
        this.fallback = fallback;
        this.maxTokens = maxTokens;
        this.maxKeywords = maxKeywords;
    }

    public Set<String> extract(String text) {
        String sanitized = sanitizer.sanitize(text);
        if (sanitized.isEmpty()) {
            return Set.of();
        }

        KeywordStrategy strategy = resourceCache.tokenizer()
                .<KeywordStrategy>map(tokenizer -> new MorphologicalKeywordStrategy(tokenizer, maxTokens, maxKeywords))
                .orElse(fallback);
        Set<String> keywords = strategy.extract(withoutCharacterReferences(sanitized));
        log.debug("[keywords] {} -> {}", strategy.getClass().getSimpleName(), keywords);
        return keywords;
    }

    private static String withoutCharacterReferences(String sanitized) {
        return MarkupEscapeValidator.CHARACTER_REFERENCE.matcher(sanitized).replaceAll(" ");
    }
}
