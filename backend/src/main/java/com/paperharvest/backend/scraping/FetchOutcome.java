package com.paperharvest.backend.scraping;

import com.paperharvest.backend.model.entity.Article;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one article fetch: the stored article, or the reason it failed
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchOutcome {
    private final String url;
    private final Article article;
    private final boolean success;
    private final String failureReason;

    public static FetchOutcome fetched(String url, Article article) {
        return new FetchOutcome(url, article, true, null);
    }

    public static FetchOutcome failed(String url, String reason) {
        return new FetchOutcome(url, null, false, reason != null ? reason : "Unknown error");
    }
}
