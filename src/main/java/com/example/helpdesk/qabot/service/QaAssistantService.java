package com.example.helpdesk.qabot.service;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.model.RankedFaq;
import com.example.helpdesk.qabot.model.RankedProduct;
import com.example.helpdesk.qabot.model.ResourceStatus;
import com.example.helpdesk.qabot.model.ScoredItem;
import com.example.helpdesk.qabot.response.QaResponse;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Entry point for a host serving questions. Each call is one request: requests are counted and
 * every {@code releaseEveryRequests}-th one releases the resource cache; a request that fails
 * unexpectedly releases it too.
 */
@Slf4j
public class QaAssistantService {

    static final String EMPTY_QUESTION_MESSAGE = "質問が入力されていません。";
    static final String DATA_LOADING_MESSAGE = "データをロード中です。しばらくお待ちください。";
    static final String MODEL_LOADING_MESSAGE = "AIモデルをロード中です。しばらくお待ちください。";
    static final String SYSTEM_LOADING_MESSAGE = "システムをロード中です。しばらくお待ちください。";
    static final String SYSTEM_ERROR_MESSAGE = "システムエラーが発生しました。";

    private final RelevanceRanker ranker;
    private final AnswerComposer composer;
    private final ResourceCache resourceCache;
    private final int releaseEveryRequests;
    private final AtomicLong requestCount = new AtomicLong();

    public QaAssistantService(RelevanceRanker ranker,
                              AnswerComposer composer,
                              ResourceCache resourceCache,
                              int releaseEveryRequests) {
        this.ranker = ranker;
        this.composer = composer;
        this.resourceCache = resourceCache;
        this.releaseEveryRequests = releaseEveryRequests;
    }

    /** Related products and FAQs only. */
    public Mono<QaResponse> search(String question) {
        return handle("search", question, q -> {
            if (!corporaAvailable()) {
                return QaResponse.loading(DATA_LOADING_MESSAGE);
            }
            return QaResponse.builder()
                    .products(ranker.rankProducts(q))
                    .faqs(ranker.rankFaqs(q))
                    .build();
        });
    }

    /** Generated answer only. */
    public Mono<QaResponse> answer(String question) {
        return handle("answer", question, q -> {
            if (resourceCache.answerGenerator().isEmpty()) {
                return QaResponse.loading(MODEL_LOADING_MESSAGE);
            }
            List<RankedProduct> products = ranker.rankProducts(q);
            List<RankedFaq> faqs = ranker.rankFaqs(q);
            return QaResponse.builder()
                    .answer(composer.compose(q, concat(products, faqs)))
                    .build();
        });
    }

    /** Related products, FAQs and the generated answer. */
    public Mono<QaResponse> ask(String question) {
        return handle("ask", question, q -> {
            if (resourceCache.answerGenerator().isEmpty() || !corporaAvailable()) {
                return QaResponse.loading(SYSTEM_LOADING_MESSAGE);
            }
            List<RankedProduct> products = ranker.rankProducts(q);
            List<RankedFaq> faqs = ranker.rankFaqs(q);
            return QaResponse.builder()
                    .products(products)
                    .faqs(faqs)
                    .answer(composer.compose(q, concat(products, faqs)))
                    .build();
        });
    }

    public Mono<ResourceStatus> status() {
        return Mono.fromSupplier(resourceCache::status);
    }

    /** Maintenance hook: drop every cached resource now. */
    public Mono<Void> release() {
        return Mono.fromRunnable(resourceCache::releaseAll);
    }

    long requestCount() {
        return requestCount.get();
    }

    private Mono<QaResponse> handle(String operation, String question, Function<String, QaResponse> body) {
        return Mono.fromCallable(() -> {
                    try {
                        if (question == null || question.isBlank()) {
                            return QaResponse.error(EMPTY_QUESTION_MESSAGE);
                        }
                        return body.apply(question);
                    } finally {
                        countRequest();
                    }
                })
                .onErrorResume(e -> {
                    log.error("[qa] {} failed, releasing cached resources", operation, e);
                    resourceCache.releaseAll();
                    return Mono.just(QaResponse.error(SYSTEM_ERROR_MESSAGE));
                });
    }

    private void countRequest() {
        long count = requestCount.incrementAndGet();
        if (releaseEveryRequests > 0 && count % releaseEveryRequests == 0) {
            log.info("[qa] {} requests served, releasing cached resources", count);
            resourceCache.releaseAll();
        }
    }

    private boolean corporaAvailable() {
        return resourceCache.products().filter(list -> !list.isEmpty()).isPresent()
                && resourceCache.faqs().filter(list -> !list.isEmpty()).isPresent();
    }

    private static List<ScoredItem> concat(List<RankedProduct> products, List<RankedFaq> faqs) {
        List<ScoredItem> all = new ArrayList<>(products.size() + faqs.size());
        all.addAll(products);
        all.addAll(faqs);
        return all;
    }
}
