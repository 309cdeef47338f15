package com.paperharvest.backend.translation;

import lombok.Getter;

@Getter
public class TranslationException extends RuntimeException {

    private final boolean retryable;

    public TranslationException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static TranslationException transientFailure(String message, Throwable cause) {
        return new TranslationException(message, true, cause);
    }

    public static TranslationException permanent(String message, Throwable cause) {
        return new TranslationException(message, false, cause);
    }
}
