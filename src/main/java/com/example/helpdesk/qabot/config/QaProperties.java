package com.example.helpdesk.qabot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds properties:
 *
 * qa.cache.ttl=300s
 * qa.corpus.products-location=classpath:corpus/products.json
 * qa.ranking.products.top-n=3
 * qa.ranking.faqs.score-gap-threshold=5
 */
@Data
@Validated
@ConfigurationProperties(prefix = "qa")
public class QaProperties {

    @Valid
    private final Cache cache = new Cache();

    @Valid
    private final Corpus corpus = new Corpus();

    @Valid
    private final Sanitizer sanitizer = new Sanitizer();

    @Valid
    private final Keywords keywords = new Keywords();

    @Valid
    private final Ranking ranking = new Ranking();

    @Data
    public static class Cache {
        /**
         * Idle time after which a cached resource is reloaded on next use.
         */
        @NotNull
        private Duration ttl = Duration.ofSeconds(300);

        /**
         * Every n-th request releases all cached resources. 0 disables the periodic release.
         */
        @Min(0)
        private int releaseEveryRequests = 100;
    }

    @Data
    public static class Corpus {
        @NotBlank
        private String productsLocation = "classpath:corpus/products.json";

        @NotBlank
        private String faqsLocation = "classpath:corpus/faqs.json";
    }

    @Data
    public static class Sanitizer {
        @Positive
        private int maxChars = 1000;
    }

    @Data
    public static class Keywords {
        /**
         * Tokens read from the morphological analyzer per question.
         */
        @Positive
        private int maxTokens = 100;

        @Positive
        private int maxKeywords = 20;
    }

    @Data
    public static class Ranking {
        @Valid
        private final Products products = new Products();

        @Valid
        private final Faqs faqs = new Faqs();
    }

    @Data
    public static class Products {
        @Min(0)
        private int scoreThreshold = 2;

        @Positive
        private int topN = 3;

        /**
         * Entries beyond this index are not scored.
         */
        @Positive
        private int scanLimit = 100;
    }

    @Data
    public static class Faqs {
        @Min(0)
        private int scoreThreshold = 5;

        @Positive
        private int topN = 2;

        @Min(0)
        private int scoreGapThreshold = 5;

        @Positive
        private int scanLimit = 50;
    }
}
