package com.paperharvest.backend.scraping.site;

import com.paperharvest.backend.util.TextUtils;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

@Slf4j
public abstract class BaseListingAdapter implements SiteAdapter {

    // CSS selectors for article links, all of them are applied
    protected abstract List<String> getArticleLinkSelectors();

    // CSS selectors for the next-page control, in priority order
    protected abstract List<String> getNextPageSelectors();

    protected abstract boolean isArticleUrl(String url, String pageUrl);

    @Override
    public Set<String> extractLinks(String pageContent, String pageUrl) {
        Document doc = Jsoup.parse(pageContent, pageUrl);
        Set<String> links = new LinkedHashSet<>();
        for (String selector : getArticleLinkSelectors()) {
            for (Element anchor : doc.select(selector)) {
                String url = TextUtils.normalizeUrl(anchor.attr("href"), pageUrl);
                if (url != null && !url.equals(pageUrl) && isArticleUrl(url, pageUrl)) {
                    links.add(url);
                }
            }
        }
        log.debug("{}: {} article links on {}", getKind(), links.size(), pageUrl);
        return links;
    }

    @Override
    public Optional<String> nextPage(String pageContent, String currentPageUrl) {
        Document doc = Jsoup.parse(pageContent, currentPageUrl);
        for (String selector : getNextPageSelectors()) {
            Set<String> candidates = new LinkedHashSet<>();
            for (Element control : doc.select(selector)) {
                String url = TextUtils.normalizeUrl(control.attr("href"), currentPageUrl);
                if (url != null && !url.equals(currentPageUrl)) {
                    candidates.add(url);
                }
            }
            if (candidates.size() > 1) {
                throw new PaginationException("Ambiguous next page on " + currentPageUrl + ": " + candidates);
            }
            if (candidates.size() == 1) {
                return Optional.of(candidates.iterator().next());
            }
        }
        return Optional.empty();
    }

    protected static boolean sameHost(String url, String pageUrl) {
        String host = TextUtils.hostOf(url);
        return host != null && host.equals(TextUtils.hostOf(pageUrl));
    }
}
