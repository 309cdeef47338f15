package com.paperharvest.backend.scraping.site;

import com.paperharvest.backend.model.enums.SiteKind;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Conference proceedings tables of contents (NeurIPS, PMLR, ACL Anthology). Most volumes fit on one
 * page; paged volumes expose a rel=next link or a pagination list.
 */
public class ProceedingsListingAdapter extends BaseListingAdapter {

    private static final List<String> LINK_SELECTORS = List.of(
            "ul.paper-list li a[href]",
            "div.paper p.links a[href]",
            "p.d-sm-flex strong a.align-middle[href]",
            "a[href*=-Abstract]"
    );

    private static final List<String> NEXT_SELECTORS = List.of(
            "link[rel=next][href]",
            "a[rel=next][href]",
            "ul.pagination li.next a[href]",
            "a.page-link[aria-label=Next][href]"
    );

    private static final Pattern DOWNLOAD = Pattern.compile("(?i)\\.(pdf|zip|bib|tar\\.gz)(\\?.*)?$");

    @Override
    public SiteKind getKind() {
        return SiteKind.PROCEEDINGS_LISTING;
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
        return sameHost(url, pageUrl) && !DOWNLOAD.matcher(url).find();
    }
}
