package com.example.helpdesk.qabot.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FaqEntry(
        @JsonProperty("question") String question,
        @JsonProperty("answer") String answer,
        @JsonProperty("related_word") @JsonAlias("related_words") List<String> relatedWords,
        @JsonProperty("related_link") @JsonAlias("related_links") String relatedLinks
) {
    public FaqEntry {
        question = Objects.requireNonNullElse(question, "");
        answer = Objects.requireNonNullElse(answer, "");
        relatedWords = relatedWords == null
                ? List.of()
                : relatedWords.stream().filter(Objects::nonNull).toList();
        relatedLinks = Objects.requireNonNullElse(relatedLinks, "");
    }

    public String searchableText() {
        return question + " " + answer + " " + String.join(" ", relatedWords) + " " + relatedLinks;
    }
}
