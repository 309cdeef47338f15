package com.paperharvest.backend.scraping.site;

/**
 * Pagination markup that cannot be followed safely. Ends the traversal.
 */
public class PaginationException extends RuntimeException {

    public PaginationException(String message) {
        super(message);
    }
}
