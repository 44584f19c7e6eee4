package com.example.helpdesk.qabot.cache;

import com.example.helpdesk.qabot.model.FaqEntry;
import com.example.helpdesk.qabot.model.ProductEntry;
import com.example.helpdesk.qabot.model.ResourceKind;
import com.example.helpdesk.qabot.model.ResourceStatus;
import com.example.helpdesk.qabot.service.AnswerGenerator;
import com.example.helpdesk.qabot.tokenizer.MorphologicalTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Owns the four resources the ranking core works with. Starts empty; each resource is loaded on
 * first use, reloaded after it has been idle longer than the TTL, and dropped by
 * {@link #releaseAll()}.
 */
@Slf4j
public class ResourceCache {

    private final CachedResource<List<ProductEntry>> products;
    private final CachedResource<List<FaqEntry>> faqs;
    private final CachedResource<MorphologicalTokenizer> tokenizer;
    private final CachedResource<AnswerGenerator> answerGenerator;
    private final Map<ResourceKind, CachedResource<?>> slots = new EnumMap<>(ResourceKind.class);

    public ResourceCache(Supplier<List<ProductEntry>> productLoader,
                         Supplier<List<FaqEntry>> faqLoader,
                         Supplier<? extends MorphologicalTokenizer> tokenizerLoader,
                         Supplier<? extends AnswerGenerator> answerGeneratorLoader,
                         Duration ttl,
                         Clock clock) {
        this.products = new CachedResource<>(ResourceKind.PRODUCTS, productLoader, ttl, clock);
        this.faqs = new CachedResource<>(ResourceKind.FAQS, faqLoader, ttl, clock);
        this.tokenizer = new CachedResource<>(ResourceKind.TOKENIZER, tokenizerLoader, ttl, clock);
        this.answerGenerator = new CachedResource<>(ResourceKind.ANSWER_GENERATOR, answerGeneratorLoader, ttl, clock);
        slots.put(ResourceKind.PRODUCTS, products);
        slots.put(ResourceKind.FAQS, faqs);
        slots.put(ResourceKind.TOKENIZER, tokenizer);
        slots.put(ResourceKind.ANSWER_GENERATOR, answerGenerator);
    }

    public Optional<List<ProductEntry>> products() {
        return products.get();
    }

    public Optional<List<FaqEntry>> faqs() {
        return faqs.get();
    }

    public Optional<MorphologicalTokenizer> tokenizer() {
        return tokenizer.get();
    }

    public Optional<AnswerGenerator> answerGenerator() {
        return answerGenerator.get();
    }

    public Optional<?> get(ResourceKind kind) {
        return slots.get(kind).get();
    }

    public boolean isLoaded(ResourceKind kind) {
        return slots.get(kind).isLoaded();
    }

    /** Peeks at every slot; an empty corpus counts as not loaded. */
    public ResourceStatus status() {
        return new ResourceStatus(
                tokenizer.isLoaded(),
                answerGenerator.isLoaded(),
                products.isLoaded(list -> !list.isEmpty()),
                faqs.isLoaded(list -> !list.isEmpty()));
    }

    /** Drops every cached value regardless of its age. */
    public void releaseAll() {
        log.info("[resource-cache] Releasing all cached resources");
        slots.values().forEach(CachedResource::release);
    }
}
