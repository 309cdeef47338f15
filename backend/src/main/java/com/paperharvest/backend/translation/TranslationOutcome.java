package com.paperharvest.backend.translation;

import com.paperharvest.backend.model.entity.Article;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TranslationOutcome {
    private final String url;
    private final Article article;
    private final boolean success;
    private final boolean fromCache;
    private final String failureReason;

    public static TranslationOutcome translated(Article article, boolean fromCache) {
        return new TranslationOutcome(article.getArticleUrl(), article, true, fromCache, null);
    }

    public static TranslationOutcome failed(String url, String reason) {
        return new TranslationOutcome(url, null, false, false, reason != null ? reason : "Unknown error");
    }
}
