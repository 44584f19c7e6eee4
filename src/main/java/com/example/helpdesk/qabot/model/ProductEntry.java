package com.example.helpdesk.qabot.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One row of the product corpus. Missing fields read as empty text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductEntry(
        @JsonProperty("商品名") @JsonAlias("name") String name,
        @JsonProperty("説明") @JsonAlias("description") String description,
        @JsonProperty("その他") @JsonAlias("notes") String notes,
        @JsonProperty("リンク") @JsonAlias("link") String link
) {
    public ProductEntry {
        name = Objects.requireNonNullElse(name, "");
        description = Objects.requireNonNullElse(description, "");
        notes = Objects.requireNonNullElse(notes, "");
        link = Objects.requireNonNullElse(link, "");
    }

    /** Name, description and notes joined by a space; the text a secondary keyword hit is searched in. */
    public String searchableText() {
        return name + " " + description + " " + notes;
    }
}
