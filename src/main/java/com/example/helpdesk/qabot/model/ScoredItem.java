package com.example.helpdesk.qabot.model;

/**
 * A corpus entry paired with its relevance score for one question. Never cached.
 */
public sealed interface ScoredItem permits RankedProduct, RankedFaq {

    int score();
}
