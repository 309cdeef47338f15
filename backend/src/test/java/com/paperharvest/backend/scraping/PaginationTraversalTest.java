package com.paperharvest.backend.scraping;

import com.paperharvest.backend.resilience.RateLimiter;
import com.paperharvest.backend.resilience.RetryPolicy;
import com.paperharvest.backend.scraping.site.SearchListingAdapter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaginationTraversalTest {

    private static final String BASE = "https://www.nature.com/search?q=x&page=";

    /**
     * Serves fixed HTML per URL, 404 for anything else, and records requests in order
     */
    static class SiteStub implements PageClient {
        final Map<String, String> pages = new HashMap<>();
        final List<String> requested = new ArrayList<>();

        @Override
        public synchronized PageResponse get(String url, Duration timeout) {
            requested.add(url);
            String body = pages.get(url);
            return body == null ? new PageResponse(404, "") : new PageResponse(200, body);
        }
    }

    static String listing(List<String> articleIds, Integer nextPage) {
        StringBuilder html = new StringBuilder("<html><head>");
        if (nextPage != null) {
            html.append("<link rel=\"next\" href=\"").append(BASE).append(nextPage).append("\">");
        }
        html.append("</head><body><ul>");
        for (String id : articleIds) {
            html.append("<li><a href=\"/articles/").append(id).append("\">").append(id).append("</a></li>");
        }
        return html.append("</ul></body></html>").toString();
    }

    private PaginationTraversal traversal(PageClient client) {
        RetryPolicy policy = new RetryPolicy("test", 1, Duration.ofMillis(1), 0.0, e -> false);
        return new PaginationTraversal(new RetryingFetcher(client, RateLimiter.unlimited(), policy, Duration.ofSeconds(5)));
    }

    private static String article(String id) {
        return "https://www.nature.com/articles/" + id;
    }

    @Nested
    @DisplayName("complete walks")
    class CompleteWalks {

        @Test
        @DisplayName("Should yield six URLs from three pages of two and stop")
        void shouldWalkAllPages() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, listing(List.of("a1", "a2"), 2));
            site.pages.put(BASE + 2, listing(List.of("b1", "b2"), 3));
            site.pages.put(BASE + 3, listing(List.of("c1", "c2"), null));

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 0);
            List<String> urls = walk.stream().collect(Collectors.toList());

            assertThat(urls).containsExactly(article("a1"), article("a2"), article("b1"),
                    article("b2"), article("c1"), article("c2"));
            assertThat(walk.getPagesVisited()).isEqualTo(3);
            assertThat(walk.getFailure()).isEmpty();
            assertThat(walk.isFinished()).isTrue();
        }

        @Test
        @DisplayName("Should yield each article once even when pages repeat it")
        void shouldDeduplicateArticles() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, listing(List.of("a1", "a2"), 2));
            site.pages.put(BASE + 2, listing(List.of("a2", "b1"), null));

            List<String> urls = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 0)
                    .stream().collect(Collectors.toList());

            assertThat(urls).containsExactly(article("a1"), article("a2"), article("b1"));
        }

        @Test
        @DisplayName("Should stop when the next link points back to a visited page")
        void shouldStopOnCycle() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, listing(List.of("a1"), 2));
            site.pages.put(BASE + 2, listing(List.of("b1"), 1));

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 0);
            List<String> urls = walk.stream().collect(Collectors.toList());

            assertThat(urls).hasSize(2);
            assertThat(site.requested).hasSize(2);
        }

        @Test
        @DisplayName("Should honour the page cap")
        void shouldHonourMaxPages() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, listing(List.of("a1", "a2"), 2));
            site.pages.put(BASE + 2, listing(List.of("b1", "b2"), 3));
            site.pages.put(BASE + 3, listing(List.of("c1", "c2"), null));

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 2);

            assertThat(walk.stream().count()).isEqualTo(4);
            assertThat(site.requested).containsExactly(BASE + 1, BASE + 2);
        }
    }

    @Nested
    @DisplayName("laziness")
    class Laziness {

        @Test
        @DisplayName("Should not fetch the next page before the current one is consumed")
        void shouldFetchLazily() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, listing(List.of("a1", "a2"), 2));
            site.pages.put(BASE + 2, listing(List.of("b1"), null));

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 0);
            assertThat(site.requested).isEmpty();

            walk.next();
            walk.next();
            assertThat(site.requested).containsExactly(BASE + 1);

            walk.next();
            assertThat(site.requested).containsExactly(BASE + 1, BASE + 2);
            assertThat(walk.hasNext()).isFalse();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("Should keep URLs found before a listing page fails")
        void shouldKeepPartialResults() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, listing(List.of("a1", "a2"), 2));
            // page 2 missing: 404

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 0);
            List<String> urls = walk.stream().collect(Collectors.toList());

            assertThat(urls).containsExactly(article("a1"), article("a2"));
            assertThat(walk.getFailure()).hasValueSatisfying(reason -> assertThat(reason).contains("404"));
        }

        @Test
        @DisplayName("Should stop with a failure on an ambiguous next page")
        void shouldFailOnAmbiguousNext() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, "<html><body><a href=\"/articles/a1\">a1</a>"
                    + "<a rel=\"next\" href=\"" + BASE + "2\">Next</a>"
                    + "<a rel=\"next\" href=\"" + BASE + "5\">Next</a></body></html>");

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 0);
            List<String> urls = walk.stream().collect(Collectors.toList());

            assertThat(urls).containsExactly(article("a1"));
            assertThat(walk.getFailure()).hasValueSatisfying(reason -> assertThat(reason).contains("Ambiguous"));
        }

        @Test
        @DisplayName("Should end as a partial result when a listing request throws unexpectedly")
        void shouldContainUnexpectedClientError() {
            SiteStub site = new SiteStub() {
                @Override
                public synchronized PageResponse get(String url, Duration timeout) {
                    if (url.equals(BASE + 2)) {
                        throw new IllegalArgumentException("Malformed URL: " + url);
                    }
                    return super.get(url, timeout);
                }
            };
            site.pages.put(BASE + 1, listing(List.of("a1", "a2"), 2));

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, new SearchListingAdapter(), 0);
            List<String> urls = walk.stream().collect(Collectors.toList());

            assertThat(urls).containsExactly(article("a1"), article("a2"));
            assertThat(walk.getPagesVisited()).isEqualTo(1);
            assertThat(walk.getFailure()).hasValueSatisfying(reason -> assertThat(reason).contains("Malformed URL"));
        }

        @Test
        @DisplayName("Should end with a failure when the adapter throws unexpectedly")
        void shouldContainUnexpectedAdapterError() {
            SiteStub site = new SiteStub();
            site.pages.put(BASE + 1, listing(List.of("a1"), null));
            SearchListingAdapter broken = new SearchListingAdapter() {
                @Override
                public Set<String> extractLinks(String pageContent, String pageUrl) {
                    throw new IllegalStateException();
                }
            };

            PaginationTraversal.Traversal walk = traversal(site).traverse(BASE + 1, broken, 0);

            assertThat(walk.hasNext()).isFalse();
            assertThat(walk.getFailure()).hasValueSatisfying(reason -> assertThat(reason).contains("IllegalStateException"));
        }
    }
}
