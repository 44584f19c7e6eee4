package com.example.helpdesk.qabot.model;

public record RankedFaq(
        String question,
        String answer,
        String relatedLinks,
        int score
) implements ScoredItem {

    public static RankedFaq of(FaqEntry entry, int score) {
        return new RankedFaq(entry.question(), entry.answer(), entry.relatedLinks(), score);
    }
}
