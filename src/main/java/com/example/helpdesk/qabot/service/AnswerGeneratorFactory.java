package com.example.helpdesk.qabot.service;

/**
 * Builds the {@link AnswerGenerator} the resource cache hands out.
 */
@FunctionalInterface
public interface AnswerGeneratorFactory {

    /**
     * @throws com.example.helpdesk.qabot.cache.ResourceLoadException when no generator can be built;
     *         a missing credential is reported as permanent
     */
    AnswerGenerator create();
}
