package com.example.helpdesk.qabot.model;

public record RankedProduct(
        String name,
        String description,
        String notes,
        String link,
        int score
) implements ScoredItem {

    public static RankedProduct of(ProductEntry entry, int score) {
        return new RankedProduct(entry.name(), entry.description(), entry.notes(), entry.link(), score);
    }
}
