package com.example.helpdesk.qabot.service;

/**
 * The external text generation service. Implementations may throw on any failure.
 */
@FunctionalInterface
public interface AnswerGenerator {

    String generate(String prompt);
}
