package com.paperharvest.backend.scraping.site;

import com.paperharvest.backend.model.enums.SiteKind;
import java.util.Optional;
import java.util.Set;

/**
 * Page-layout knowledge for one kind of listing site. Implementations parse content that has
 * already been fetched and never do network I/O.
 */
public interface SiteAdapter {

    SiteKind getKind();

    /**
     * Absolute article URLs listed on the page, in page order
     */
    Set<String> extractLinks(String pageContent, String pageUrl);

    /**
     * URL of the following listing page, empty on the last page
     *
     * @throws PaginationException when the page's pagination controls cannot be read unambiguously
     */
    Optional<String> nextPage(String pageContent, String currentPageUrl);
}
