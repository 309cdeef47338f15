package com.paperharvest.backend.scraping;

import com.paperharvest.backend.scraping.site.PaginationException;
import com.paperharvest.backend.scraping.site.SiteAdapter;
import com.paperharvest.backend.util.TextUtils;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Walks listing pages from a start URL and yields article URLs lazily: the next listing page is
 * only fetched once every URL of the current one has been consumed.
 */
@Slf4j
@RequiredArgsConstructor
public class PaginationTraversal {

    private final RetryingFetcher fetcher;

    /**
     * Start a new walk. Every call begins again at {@code startUrl}.
     *
     * @param maxPages page cap, 0 or less for no cap
     */
    public Traversal traverse(String startUrl, SiteAdapter adapter, int maxPages) {
        return new Traversal(startUrl, adapter, maxPages);
    }

    public final class Traversal implements Iterator<String> {

        private final SiteAdapter adapter;
        private final int maxPages;
        private final Set<String> seenArticles = new HashSet<>();
        private final Set<String> visitedPages = new HashSet<>();
        private final Deque<String> buffer = new ArrayDeque<>();
        private String nextPageUrl;
        private int pagesVisited;
        private String failure;
        private boolean finished;

        private Traversal(String startUrl, SiteAdapter adapter, int maxPages) {
            this.nextPageUrl = startUrl;
            this.adapter = adapter;
            this.maxPages = maxPages;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !finished) {
                loadNextPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        public Stream<String> stream() {
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
        }

        public int getPagesVisited() {
            return pagesVisited;
        }

        public int getDiscovered() {
            return seenArticles.size();
        }

        /**
         * Why the walk ended early, empty when it ran to the last page or the page cap
         */
        public Optional<String> getFailure() {
            return Optional.ofNullable(failure);
        }

        public boolean isFinished() {
            return finished;
        }

        private void loadNextPage() {
            if (nextPageUrl == null) {
                finished = true;
                return;
            }
            if (maxPages > 0 && pagesVisited >= maxPages) {
                log.info("Reached page cap of {} pages", maxPages);
                finished = true;
                return;
            }
            if (!visitedPages.add(nextPageUrl)) {
                log.info("Next page {} was already visited, stopping", nextPageUrl);
                finished = true;
                return;
            }

            String pageUrl = nextPageUrl;
            String content;
            try {
                content = fetcher.fetch(pageUrl);
            } catch (FetchException e) {
                fail("Listing page fetch failed: " + e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error fetching listing page {}", pageUrl, e);
                fail("Listing page fetch failed: " + TextUtils.describe(e));
                return;
            }
            pagesVisited++;

            int added = 0;
            try {
                for (String url : adapter.extractLinks(content, pageUrl)) {
                    if (seenArticles.add(url)) {
                        buffer.add(url);
                        added++;
                    }
                }
                nextPageUrl = adapter.nextPage(content, pageUrl).orElse(null);
            } catch (PaginationException e) {
                fail(e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error parsing listing page {}", pageUrl, e);
                fail("Listing page could not be parsed: " + TextUtils.describe(e));
                return;
            }
            log.info("Page {} ({}): {} new article URLs, {} total", pagesVisited, pageUrl, added, seenArticles.size());
        }

        private void fail(String reason) {
            log.warn("Traversal stopped after {} pages: {}", pagesVisited, reason);
            failure = reason;
            finished = true;
        }
    }
}
