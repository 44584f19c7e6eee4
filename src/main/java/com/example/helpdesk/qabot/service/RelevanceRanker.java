package com.example.helpdesk.qabot.service;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.config.QaProperties;
import com.example.helpdesk.qabot.keyword.KeywordExtractor;
import com.example.helpdesk.qabot.model.FaqEntry;
import com.example.helpdesk.qabot.model.ProductEntry;
import com.example.helpdesk.qabot.model.RankedFaq;
import com.example.helpdesk.qabot.model.RankedProduct;
import com.example.helpdesk.qabot.util.RankSelectionUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Scores the product and FAQ corpora against the keywords of a question.
 *
 * <p>Products: per keyword, 5 for a hit in the name, otherwise 2 for a hit anywhere in
 * name/description/notes. FAQs: per keyword, 5 for a hit in the question plus either 4 for a
 * hit in the answer or 3 for a hit anywhere in the entry. Matching is plain substring
 * containment.
 */
@Slf4j
public class RelevanceRanker {

    static final int PRODUCT_NAME_SCORE = 5;
    static final int PRODUCT_TEXT_SCORE = 2;
    static final int FAQ_QUESTION_SCORE = 5;
    static final int FAQ_ANSWER_SCORE = 4;
    static final int FAQ_TEXT_SCORE = 3;

    private final KeywordExtractor keywordExtractor;
    private final ResourceCache resourceCache;
    private final QaProperties.Products productSettings;
    private final QaProperties.Faqs faqSettings;

    public RelevanceRanker(KeywordExtractor keywordExtractor,
                           ResourceCache resourceCache,
                           QaProperties.Ranking ranking) {
        this.keywordExtractor = keywordExtractor;
        this.resourceCache = resourceCache;
        this.productSettings = ranking.getProducts();
        this.faqSettings = ranking.getFaqs();
    }

    public List<RankedProduct> rankProducts(String question) {
        return rankProducts(question, productSettings.getScoreThreshold(), productSettings.getTopN());
    }

    public List<RankedProduct> rankProducts(String question, int scoreThreshold, int topN) {
        Set<String> keywords = keywordExtractor.extract(question);
        if (keywords.isEmpty()) {
            return List.of();
        }
        List<ProductEntry> corpus = resourceCache.products().orElse(List.of());
        if (corpus.isEmpty()) {
            return List.of();
        }

        List<RankedProduct> results = new ArrayList<>();
        for (ProductEntry product : head(corpus, productSettings.getScanLimit())) {
            int score = scoreProduct(product, keywords);
            if (score >= scoreThreshold) {
                results.add(RankedProduct.of(product, score));
            }
        }
        results.sort(Comparator.comparingInt(RankedProduct::score).reversed());

        List<RankedProduct> selected = RankSelectionUtils.topNWithTies(results, topN, RankedProduct::score);
        log.debug("[ranker] products keywords={} matched={} selected={}", keywords, results.size(), selected.size());
        return selected;
    }

    public List<RankedFaq> rankFaqs(String question) {
        return rankFaqs(question,
                faqSettings.getScoreThreshold(),
                faqSettings.getTopN(),
                faqSettings.getScoreGapThreshold());
    }

    public List<RankedFaq> rankFaqs(String question, int scoreThreshold, int topN, int scoreGapThreshold) {
        Set<String> keywords = keywordExtractor.extract(question);
        if (keywords.isEmpty()) {
            return List.of();
        }
        List<FaqEntry> corpus = resourceCache.faqs().orElse(List.of());
        if (corpus.isEmpty()) {
            return List.of();
        }

        List<RankedFaq> results = new ArrayList<>();
        for (FaqEntry faq : head(corpus, faqSettings.getScanLimit())) {
            int score = scoreFaq(faq, keywords);
            if (score >= scoreThreshold) {
                results.add(RankedFaq.of(faq, score));
            }
        }
        results.sort(Comparator.comparingInt(RankedFaq::score).reversed());

        if (results.size() < 2) {
            return List.copyOf(results);
        }
        // the gap rule runs before the top-n cut
        if (RankSelectionUtils.hasDominantLead(results, scoreGapThreshold, RankedFaq::score)) {
            log.debug("[ranker] faq '{}' dominates with score {}", results.get(0).question(), results.get(0).score());
            return List.of(results.get(0));
        }
        return RankSelectionUtils.topNWithTies(results, topN, RankedFaq::score);
    }

    static int scoreProduct(ProductEntry product, Set<String> keywords) {
        String searchable = product.searchableText();
        int score = 0;
        for (String keyword : keywords) {
            if (product.name().contains(keyword)) {
                score += PRODUCT_NAME_SCORE;
            } else if (searchable.contains(keyword)) {
                score += PRODUCT_TEXT_SCORE;
            }
        }
        return score;
    }

    static int scoreFaq(FaqEntry faq, Set<String> keywords) {
        String searchable = faq.searchableText();
        int score = 0;
        for (String keyword : keywords) {
            if (faq.question().contains(keyword)) {
                score += FAQ_QUESTION_SCORE;
            }
            if (faq.answer().contains(keyword)) {
                score += FAQ_ANSWER_SCORE;
            } else if (searchable.contains(keyword)) {
                score += FAQ_TEXT_SCORE;
            }
        }
        return score;
    }

    private static <T> List<T> head(List<T> corpus, int limit) {
        return corpus.size() <= limit ? corpus : corpus.subList(0, limit);
    }
}
