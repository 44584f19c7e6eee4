package com.example.helpdesk.qabot.service;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.model.ScoredItem;
import com.example.helpdesk.qabot.util.PromptRenderUtils;
import com.example.helpdesk.qabot.validation.TextSanitizer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Builds the answer prompt from the ranked items and hands it to the answer generator. Never
 * throws: every failure maps to one of the fixed messages below.
 */
@Slf4j
public class AnswerComposer {

    public static final String INVALID_INPUT_MESSAGE = "質問の内容が無効です。入力内容を確認してください。";
    public static final String MODEL_NOT_LOADED_MESSAGE =
            "AIモデルがロードされていないため、回答を生成できません。しばらくお待ちください。";
    public static final String NO_RELATED_INFO_MESSAGE = "関連情報が見つかりませんでした。";
    public static final String GENERATION_FAILED_MESSAGE =
            "回答生成中にエラーが発生しました。しばらくしてから再度お試しください。";

    private final TextSanitizer sanitizer;
    private final ResourceCache resourceCache;
    private final int maxContextItems;

    public AnswerComposer(TextSanitizer sanitizer, ResourceCache resourceCache, int maxContextItems) {
        this.sanitizer = sanitizer;
        this.resourceCache = resourceCache;
        this.maxContextItems = maxContextItems;
    }

    public String compose(String question, List<? extends ScoredItem> rankedItems) {
        String sanitizedQuestion = sanitizer.sanitize(question);
        if (sanitizedQuestion.isEmpty()) {
            return INVALID_INPUT_MESSAGE;
        }

        Optional<AnswerGenerator> generator = resourceCache.answerGenerator();
        if (generator.isEmpty()) {
            return MODEL_NOT_LOADED_MESSAGE;
        }

        if (rankedItems == null || rankedItems.isEmpty()) {
            return NO_RELATED_INFO_MESSAGE;
        }

        String context = PromptRenderUtils.renderContext(rankedItems, maxContextItems, sanitizer::escape);
        String prompt = PromptRenderUtils.renderAnswerPrompt(sanitizedQuestion, context);

        try {
            String answer = generator.get().generate(prompt);
            if (answer == null) {
                log.warn("[answer] Generator returned no text");
                return GENERATION_FAILED_MESSAGE;
            }
            return answer.strip();
        } catch (RuntimeException e) {
            log.warn("[answer] Answer generation failed: {}", e.getMessage(), e);
            return GENERATION_FAILED_MESSAGE;
        }
    }
}
