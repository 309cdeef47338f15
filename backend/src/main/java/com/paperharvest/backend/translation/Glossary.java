package com.paperharvest.backend.translation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Terms already introduced somewhere in the corpus, shared by every translation worker.
 * <p>
 * {@link #claim} is the check-then-register step: of several workers meeting the same new term,
 * exactly one gets the first occurrence. Only that step holds the lock; translation calls run
 * outside it.
 */
@Slf4j
@Component
public class Glossary {

    private final Map<String, GlossaryTerm> terms = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Case-insensitive, whitespace-collapsed form used as the glossary key
     */
    public static String normalize(String term) {
        return term.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public TermClaim claim(String term, String articleUrl) {
        String key = normalize(term);
        lock.lock();
        try {
            GlossaryTerm existing = terms.get(key);
            if (existing == null) {
                terms.put(key, new GlossaryTerm(term.trim(), key, articleUrl, null));
                return new TermClaim(term, key, true);
            }
            // The introducing article may ask again, e.g. when it is retried in the same run
            boolean own = !existing.isRendered() && articleUrl.equals(existing.getFirstArticleUrl());
            return new TermClaim(term, key, own);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fix the Chinese rendering of a term introduced by {@code articleUrl}. A rendering is never replaced.
     *
     * @return the updated term, empty if the article does not own the term or it already has a rendering
     */
    public Optional<GlossaryTerm> assignRendering(String normalizedTerm, String articleUrl, String rendering) {
        lock.lock();
        try {
            GlossaryTerm term = terms.get(normalizedTerm);
            if (term == null || term.isRendered() || !articleUrl.equals(term.getFirstArticleUrl())) {
                return Optional.empty();
            }
            term.setRendering(rendering);
            return Optional.of(term);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop claims of {@code articleUrl} that never got a rendering, so another article can introduce them
     */
    public int releaseUnrendered(String articleUrl) {
        lock.lock();
        try {
            int released = 0;
            Iterator<GlossaryTerm> it = terms.values().iterator();
            while (it.hasNext()) {
                GlossaryTerm term = it.next();
                if (!term.isRendered() && articleUrl.equals(term.getFirstArticleUrl())) {
                    it.remove();
                    released++;
                }
            }
            if (released > 0) {
                log.debug("Released {} unrendered terms of {}", released, articleUrl);
            }
            return released;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the contents with previously persisted terms, starting a new run
     */
    public void reload(Collection<GlossaryTerm> persisted) {
        lock.lock();
        try {
            terms.clear();
            for (GlossaryTerm term : persisted) {
                terms.putIfAbsent(term.getNormalizedTerm(), term);
            }
            log.info("Glossary loaded with {} terms", terms.size());
        } finally {
            lock.unlock();
        }
    }

    public static GlossaryTerm restored(String sourceTerm, String firstArticleUrl, String rendering) {
        return new GlossaryTerm(sourceTerm, normalize(sourceTerm), firstArticleUrl, rendering);
    }

    public Optional<GlossaryTerm> lookup(String term) {
        lock.lock();
        try {
            return Optional.ofNullable(terms.get(normalize(term)));
        } finally {
            lock.unlock();
        }
    }

    public List<GlossaryTerm> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(terms.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return terms.size();
        } finally {
            lock.unlock();
        }
    }
}
