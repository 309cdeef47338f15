package com.paperharvest.backend.translation;

import com.paperharvest.backend.article.ArticleStore;
import com.paperharvest.backend.config.TranslationConfig;
import com.paperharvest.backend.model.dto.TaskStatusDTO;
import com.paperharvest.backend.model.dto.TranslationRequestDTO;
import com.paperharvest.backend.model.dto.TranslationSummaryDTO;
import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.model.entity.GlossaryEntry;
import com.paperharvest.backend.model.enums.ArticleStatus;
import com.paperharvest.backend.resilience.RateLimiter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Translates every fetched abstract that has no Chinese version yet
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranslationService {

    private static final EnumSet<ArticleStatus> PENDING = EnumSet.of(ArticleStatus.FETCHED, ArticleStatus.TRANSLATE_FAILED);

    private final ArticleStore articleStore;
    private final TranslationClient translationClient;
    private final TermSegmenter termSegmenter;
    private final Glossary glossary;
    private final TerminologyRenderer terminologyRenderer;
    private final GlossaryEntryRepository glossaryEntryRepository;
    private final TranslationConfig translationConfig;

    private final Map<String, TaskStatusDTO> taskStatuses = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

    public TranslationSummaryDTO translate(TranslationRequestDTO request) {
        return translate(request, new AtomicBoolean(false));
    }

    public synchronized TranslationSummaryDTO translate(TranslationRequestDTO request, AtomicBoolean cancelled) {
        articleStore.checkAvailable();

        String model = request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel().trim() : translationConfig.getModel();
        int concurrency = request.getConcurrency() != null ? request.getConcurrency() : translationConfig.getConcurrency();
        double rate = request.getRate() != null ? request.getRate() : translationConfig.getRate();
        int maxItems = request.getMaxItems() != null ? request.getMaxItems() : translationConfig.getMaxItems();

        long startTime = System.currentTimeMillis();
        String startedAt = now();
        reloadGlossary();
        int glossaryBefore = glossary.size();

        List<Article> pending = articleStore.listPending(PENDING, maxItems);
        log.info("{} abstracts pending translation (model={}, concurrency={}, rate={}/s)",
                pending.size(), model, concurrency, rate);

        AtomicInteger translated = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger cached = new AtomicInteger();
        AtomicInteger done = new AtomicInteger();
        int total = pending.size();

        TranslationPool pool = TranslationPool.builder()
                .translationClient(translationClient)
                .termSegmenter(termSegmenter)
                .glossary(glossary)
                .renderer(terminologyRenderer)
                .articleStore(articleStore)
                .retryPolicy(TranslationPool.retryPolicy(translationConfig.getMaxAttempts(),
                        translationConfig.getBaseDelayMillis(), translationConfig.getJitter()))
                .rateLimiter(new RateLimiter(rate, translationConfig.getBurst()))
                .model(model)
                .targetLanguage(translationConfig.getTargetLanguage())
                .onTermRendered(this::persistTerm)
                .build();

        pool.translateAll(pending, concurrency, cancelled, outcome -> {
            if (outcome.isSuccess()) {
                translated.incrementAndGet();
                if (outcome.isFromCache()) cached.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
            log.info("[{}/{}] {} {}", done.incrementAndGet(), total,
                    outcome.isSuccess() ? "done" : "failed", outcome.getUrl());
        });

        double durationSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        TranslationSummaryDTO summary = new TranslationSummaryDTO();
        summary.setModel(model);
        summary.setPending(total);
        summary.setTranslated(translated.get());
        summary.setFailed(failed.get());
        summary.setCached(cached.get());
        summary.setGlossaryTermsAdded(Math.max(0, glossary.size() - glossaryBefore));
        summary.setCancelled(cancelled.get());
        summary.setStartedAt(startedAt);
        summary.setCompletedAt(now());
        summary.setDurationSeconds(durationSeconds);

        log.info("Translation completed: {}/{} translated ({} cached), {} failed, {} new glossary terms in {}s",
                summary.getTranslated(), total, summary.getCached(), summary.getFailed(),
                summary.getGlossaryTermsAdded(), String.format("%.2f", durationSeconds));
        return summary;
    }

    @Async("translationTaskExecutor")
    public CompletableFuture<TranslationSummaryDTO> translateAsync(String taskId, TranslationRequestDTO request) {
        AtomicBoolean cancelled = cancellations.computeIfAbsent(taskId, id -> new AtomicBoolean(false));
        TaskStatusDTO status = taskStatuses.computeIfAbsent(taskId, this::newStatus);
        try {
            TranslationSummaryDTO summary = translate(request, cancelled);
            status.setStatus("COMPLETED");
            status.setSummary(summary);
            status.setCompletedAt(now());
            return CompletableFuture.completedFuture(summary);
        } catch (Exception e) {
            log.error("Error in async translation task {}: {}", taskId, e.getMessage());
            status.setStatus("FAILED");
            status.setError(e.getMessage());
            status.setCompletedAt(now());
            return CompletableFuture.failedFuture(e);
        } finally {
            cancellations.remove(taskId);
        }
    }

    public String registerTask() {
        String taskId = "translate-" + System.currentTimeMillis();
        taskStatuses.put(taskId, newStatus(taskId));
        cancellations.put(taskId, new AtomicBoolean(false));
        return taskId;
    }

    public boolean cancel(String taskId) {
        AtomicBoolean flag = cancellations.get(taskId);
        if (flag == null) return false;
        flag.set(true);
        TaskStatusDTO status = taskStatuses.get(taskId);
        if (status != null && "RUNNING".equals(status.getStatus())) {
            status.setStatus("CANCELLING");
        }
        return true;
    }

    public TaskStatusDTO getTaskStatus(String taskId) {
        return taskStatuses.get(taskId);
    }

    public Map<String, TaskStatusDTO> getAllTaskStatuses() {
        return new ConcurrentHashMap<>(taskStatuses);
    }

    public List<GlossaryTerm> getGlossary() {
        return glossary.snapshot().stream()
                .filter(GlossaryTerm::isRendered)
                .collect(Collectors.toList());
    }

    private void reloadGlossary() {
        List<GlossaryTerm> persisted = glossaryEntryRepository.findAll().stream()
                .map(e -> Glossary.restored(e.getSourceTerm(), e.getFirstArticleUrl(), e.getRendering()))
                .collect(Collectors.toList());
        glossary.reload(persisted);
    }

    private void persistTerm(GlossaryTerm term) {
        try {
            if (glossaryEntryRepository.findByNormalizedTerm(term.getNormalizedTerm()).isPresent()) {
                return;
            }
            glossaryEntryRepository.save(GlossaryEntry.builder()
                    .normalizedTerm(term.getNormalizedTerm())
                    .sourceTerm(term.getSourceTerm())
                    .rendering(term.getRendering())
                    .firstArticleUrl(term.getFirstArticleUrl())
                    .build());
            log.debug("New glossary term: {}（{}）", term.getSourceTerm(), term.getRendering());
        } catch (DataAccessException e) {
            log.error("Failed to persist glossary term {}: {}", term.getSourceTerm(), e.getMessage());
        }
    }

    private TaskStatusDTO newStatus(String taskId) {
        TaskStatusDTO status = new TaskStatusDTO();
        status.setTaskId(taskId);
        status.setStatus("RUNNING");
        status.setPhase("translate");
        status.setStartedAt(now());
        return status;
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
