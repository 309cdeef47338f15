package com.paperharvest.backend.scraping;

/**
 * Article page fetched but unusable, for example without an abstract. Never retried.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }
}
