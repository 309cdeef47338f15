package com.paperharvest.backend.translation;

import lombok.Getter;
import lombok.ToString;

/**
 * One glossary entry. The rendering is assigned at most once, under the glossary lock.
 */
@Getter
@ToString
public class GlossaryTerm {
    private final String sourceTerm;
    private final String normalizedTerm;
    private final String firstArticleUrl;
    private volatile String rendering;

    GlossaryTerm(String sourceTerm, String normalizedTerm, String firstArticleUrl, String rendering) {
        this.sourceTerm = sourceTerm;
        this.normalizedTerm = normalizedTerm;
        this.firstArticleUrl = firstArticleUrl;
        this.rendering = rendering;
    }

    void setRendering(String rendering) {
        this.rendering = rendering;
    }

    public boolean isRendered() {
        return rendering != null;
    }
}
