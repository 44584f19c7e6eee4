package com.example.helpdesk.qabot.keyword;

import java.util.Set;

/**
 * Turns already sanitized text into a set of keywords.
 */
public interface KeywordStrategy {

    Set<String> extract(String sanitizedText);
}
