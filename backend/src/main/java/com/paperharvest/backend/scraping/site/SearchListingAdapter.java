package com.paperharvest.backend.scraping.site;

import com.paperharvest.backend.model.enums.SiteKind;
import java.util.List;

/**
 * Search-engine-style result listings (nature.com search and similar): article pages live
 * under {@code /articles/}, further results are reached through a "next" link.
 */
public class SearchListingAdapter extends BaseListingAdapter {

    private static final List<String> LINK_SELECTORS = List.of("a[href]");

    private static final List<String> NEXT_SELECTORS = List.of(
            "link[rel=next][href]",
            "a[rel=next][href]",
            "a[href]:matchesOwn((?i)^\\s*next(\\s+page)?\\s*$)",
            "a[href][aria-label~=(?i)^next(\\s+page)?$]"
    );

    @Override
    public SiteKind getKind() {
        return SiteKind.SEARCH_LISTING;
    }

    @Override
    protected List<String> getArticleLinkSelectors() {
        return LINK_SELECTORS;
    }

    @Override
    protected List<String> getNextPageSelectors() {
        return NEXT_SELECTORS;
    }

    @Override
    protected boolean isArticleUrl(String url, String pageUrl) {
        return sameHost(url, pageUrl) && url.contains("/articles/");
    }
}
