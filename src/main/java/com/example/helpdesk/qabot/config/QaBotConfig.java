package com.example.helpdesk.qabot.config;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.dao.CorpusDao;
import com.example.helpdesk.qabot.keyword.KeywordExtractor;
import com.example.helpdesk.qabot.service.AnswerComposer;
import com.example.helpdesk.qabot.service.AnswerGeneratorFactory;
import com.example.helpdesk.qabot.service.QaAssistantService;
import com.example.helpdesk.qabot.service.RelevanceRanker;
import com.example.helpdesk.qabot.tokenizer.KuromojiMorphologicalTokenizer;
import com.example.helpdesk.qabot.validation.TextSanitizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        QaProperties.class,
        AnswerModelProperties.class
})
public class QaBotConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Empty at startup; nothing is read until the first question arrives.
     */
    @Bean
    public ResourceCache resourceCache(CorpusDao corpusDao,
                                       AnswerGeneratorFactory answerGeneratorFactory,
                                       QaProperties props,
                                       Clock clock) {
        return new ResourceCache(
                corpusDao::loadProducts,
                corpusDao::loadFaqs,
                KuromojiMorphologicalTokenizer::new,
                answerGeneratorFactory::create,
                props.getCache().getTtl(),
                clock);
    }

    @Bean
    public KeywordExtractor keywordExtractor(TextSanitizer sanitizer, ResourceCache resourceCache, QaProperties props) {
        return new KeywordExtractor(sanitizer, resourceCache, props.getKeywords());
    }

    @Bean
    public RelevanceRanker relevanceRanker(KeywordExtractor keywordExtractor,
                                           ResourceCache resourceCache,
                                           QaProperties props) {
        return new RelevanceRanker(keywordExtractor, resourceCache, props.getRanking());
    }

    @Bean
    public AnswerComposer answerComposer(TextSanitizer sanitizer,
                                         ResourceCache resourceCache,
                                         AnswerModelProperties answerProps) {
        return new AnswerComposer(sanitizer, resourceCache, answerProps.getMaxContextItems());
    }

    @Bean
    public QaAssistantService qaAssistantService(RelevanceRanker ranker,
                                                 AnswerComposer composer,
                                                 ResourceCache resourceCache,
                                                 QaProperties props) {
        return new QaAssistantService(ranker, composer, resourceCache, props.getCache().getReleaseEveryRequests());
    }
}
