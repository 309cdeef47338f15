package com.paperharvest.backend.translation;

/**
 * Machine translation of one English abstract
 */
public interface TranslationClient {

    /**
     * @throws TranslationException on failure; {@link TranslationException#isRetryable()} tells
     *                              rate limiting and server errors apart from permanent ones
     */
    String translate(String text, TranslationContext context);
}
