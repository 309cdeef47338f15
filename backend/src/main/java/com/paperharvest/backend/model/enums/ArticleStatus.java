package com.paperharvest.backend.model.enums;

/**
 * Lifecycle of a stored article. Declaration order is progress order: a later write
 * never moves a row to an earlier status.
 */
public enum ArticleStatus {
    DISCOVERED,
    FETCH_FAILED,
    FETCHED,
    TRANSLATE_FAILED,
    TRANSLATED;

    public boolean isAtLeast(ArticleStatus other) {
        return compareTo(other) >= 0;
    }

    /**
     * Status kept when a row in this status receives a write carrying {@code incoming}
     */
    public ArticleStatus merge(ArticleStatus incoming) {
        if (incoming == null) return this;
        return incoming.isAtLeast(this) ? incoming : this;
    }
}
