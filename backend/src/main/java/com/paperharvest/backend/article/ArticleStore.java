package com.paperharvest.backend.article;

import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.model.enums.ArticleStatus;
import com.paperharvest.backend.util.TextUtils;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Idempotent persistence of article rows keyed by article URL.
 * <p>
 * Writes merge field by field: a blank incoming value never replaces a stored one, and the status
 * only moves forward (see {@link ArticleStatus#merge}). Rows for different URLs may be written
 * concurrently; callers guarantee a single writer per URL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class ArticleStore {

    private final ArticleRepository articleRepository;

    public Article upsert(Article incoming) {
        String url = TextUtils.cleanText(incoming.getArticleUrl());
        if (url == null) {
            throw new IllegalArgumentException("Article URL is required");
        }
        try {
            Article row = articleRepository.findByArticleUrl(url)
                    .map(existing -> merge(existing, incoming))
                    .orElseGet(() -> newRow(url, incoming));
            return articleRepository.save(row);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to upsert " + url, e);
        }
    }

    /**
     * Record a URL seen on a listing page. Existing rows are left untouched apart from a missing search URL.
     */
    public Article markDiscovered(String articleUrl, String searchUrl) {
        return upsert(Article.builder()
                .articleUrl(articleUrl)
                .searchUrl(searchUrl)
                .status(ArticleStatus.DISCOVERED)
                .build());
    }

    @Transactional(readOnly = true)
    public boolean hasAbstract(String articleUrl) {
        try {
            return articleRepository.existsByArticleUrlAndAbstractEnIsNotNull(articleUrl);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read " + articleUrl, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Article> find(String articleUrl) {
        try {
            return articleRepository.findByArticleUrl(articleUrl);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read " + articleUrl, e);
        }
    }

    /**
     * Rows in one of {@code statuses} that have an English abstract, oldest first
     *
     * @param maxItems cap, 0 or less for all
     */
    @Transactional(readOnly = true)
    public List<Article> listPending(Collection<ArticleStatus> statuses, int maxItems) {
        Pageable page = maxItems > 0 ? PageRequest.of(0, maxItems) : Pageable.unpaged();
        try {
            return articleRepository.findPending(statuses, page);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list pending articles", e);
        }
    }

    public Article updateTranslation(String articleUrl, String abstractZh) {
        if (TextUtils.isBlank(abstractZh)) {
            throw new IllegalArgumentException("Translation for " + articleUrl + " is empty");
        }
        try {
            Article row = articleRepository.findByArticleUrl(articleUrl)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown article " + articleUrl));
            row.setAbstractZh(abstractZh.trim());
            row.setStatus(ArticleStatus.TRANSLATED);
            row.setFailureReason(null);
            row.setTranslatedAt(LocalDateTime.now());
            return articleRepository.save(row);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store translation for " + articleUrl, e);
        }
    }

    public void markTranslateFailed(String articleUrl, String reason) {
        try {
            articleRepository.findByArticleUrl(articleUrl).ifPresent(row -> {
                if (row.getStatus() == ArticleStatus.TRANSLATED) {
                    return;
                }
                row.setStatus(ArticleStatus.TRANSLATE_FAILED);
                row.setAbstractZh(null);
                row.setFailureReason(truncate(reason));
                articleRepository.save(row);
            });
        } catch (DataAccessException e) {
            throw new StorageException("Failed to mark " + articleUrl + " as translate_failed", e);
        }
    }

    /**
     * Chinese abstract of an already translated row with the same English abstract hash
     */
    @Transactional(readOnly = true)
    public Optional<String> findCachedTranslation(String abstractEnHash) {
        if (abstractEnHash == null) return Optional.empty();
        try {
            return articleRepository.findTranslationsByHash(abstractEnHash, ArticleStatus.TRANSLATED, PageRequest.of(0, 1))
                    .stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read translation cache", e);
        }
    }

    @Transactional(readOnly = true)
    public List<Article> findForExport(String searchUrl) {
        try {
            return TextUtils.isBlank(searchUrl)
                    ? articleRepository.findAllByOrderByIdAsc()
                    : articleRepository.findBySearchUrlOrderByIdAsc(searchUrl.trim());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read articles for export", e);
        }
    }

    @Transactional(readOnly = true)
    public Page<Article> list(ArticleStatus status, Pageable pageable) {
        try {
            return status == null
                    ? articleRepository.findAll(pageable)
                    : articleRepository.findByStatus(status, pageable);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list articles", e);
        }
    }

    @Transactional(readOnly = true)
    public Map<ArticleStatus, Long> countByStatus() {
        Map<ArticleStatus, Long> counts = new EnumMap<>(ArticleStatus.class);
        try {
            for (ArticleStatus status : ArticleStatus.values()) {
                counts.put(status, articleRepository.countByStatus(status));
            }
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count articles", e);
        }
        return counts;
    }

    /**
     * Fails fast when the store cannot be reached at all
     */
    @Transactional(readOnly = true)
    public long checkAvailable() {
        try {
            return articleRepository.count();
        } catch (DataAccessException e) {
            throw new StorageException("Article store is unreachable", e);
        }
    }

    private Article newRow(String url, Article incoming) {
        ArticleStatus status = incoming.getStatus() != null ? incoming.getStatus() : ArticleStatus.DISCOVERED;
        String abstractEn = TextUtils.cleanText(incoming.getAbstractEn());
        return Article.builder()
                .articleUrl(url)
                .searchUrl(TextUtils.cleanText(incoming.getSearchUrl()))
                .title(TextUtils.cleanText(incoming.getTitle()))
                .journal(TextUtils.cleanText(incoming.getJournal()))
                .publishedDate(TextUtils.cleanText(incoming.getPublishedDate()))
                .abstractEn(abstractEn)
                .abstractEnHash(abstractEn != null ? hashOf(incoming, abstractEn) : null)
                .abstractZh(status == ArticleStatus.TRANSLATED ? TextUtils.cleanText(incoming.getAbstractZh()) : null)
                .status(status)
                .failureReason(truncate(incoming.getFailureReason()))
                .crawledAt(incoming.getCrawledAt())
                .translatedAt(status == ArticleStatus.TRANSLATED ? incoming.getTranslatedAt() : null)
                .build();
    }

    private Article merge(Article existing, Article incoming) {
        String incomingAbstract = TextUtils.cleanText(incoming.getAbstractEn());
        boolean abstractChanged = incomingAbstract != null && !incomingAbstract.equals(existing.getAbstractEn());

        // first listing wins, so export filters stay stable
        existing.setSearchUrl(coalesce(existing.getSearchUrl(), incoming.getSearchUrl()));
        existing.setTitle(coalesce(incoming.getTitle(), existing.getTitle()));
        existing.setJournal(coalesce(incoming.getJournal(), existing.getJournal()));
        existing.setPublishedDate(coalesce(incoming.getPublishedDate(), existing.getPublishedDate()));
        if (abstractChanged) {
            existing.setAbstractEn(incomingAbstract);
            existing.setAbstractEnHash(hashOf(incoming, incomingAbstract));
        }
        if (incoming.getCrawledAt() != null && (existing.getCrawledAt() == null || abstractChanged)) {
            existing.setCrawledAt(incoming.getCrawledAt());
        }

        ArticleStatus previous = existing.getStatus() != null ? existing.getStatus() : ArticleStatus.DISCOVERED;
        ArticleStatus merged = previous.merge(incoming.getStatus());
        existing.setStatus(merged);
        if (merged == incoming.getStatus() && (previous != merged || incoming.getFailureReason() != null)) {
            existing.setFailureReason(truncate(incoming.getFailureReason()));
        }

        if (merged == ArticleStatus.TRANSLATED) {
            existing.setAbstractZh(coalesce(incoming.getAbstractZh(), existing.getAbstractZh()));
            if (incoming.getTranslatedAt() != null && existing.getTranslatedAt() == null) {
                existing.setTranslatedAt(incoming.getTranslatedAt());
            }
        } else {
            existing.setAbstractZh(null);
        }
        return existing;
    }

    private static String hashOf(Article incoming, String abstractEn) {
        return incoming.getAbstractEnHash() != null ? incoming.getAbstractEnHash() : TextUtils.sha256(abstractEn);
    }

    private static String coalesce(String incoming, String existing) {
        String cleaned = TextUtils.cleanText(incoming);
        return cleaned != null ? cleaned : existing;
    }

    private static String truncate(String reason) {
        if (reason == null) return null;
        return reason.length() > 2000 ? reason.substring(0, 2000) : reason;
    }
}
