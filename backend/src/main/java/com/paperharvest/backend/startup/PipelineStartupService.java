package com.paperharvest.backend.startup;

import com.paperharvest.backend.export.ArticleExporter;
import com.paperharvest.backend.export.ExportFormat;
import com.paperharvest.backend.model.dto.CrawlRequestDTO;
import com.paperharvest.backend.model.dto.CrawlSummaryDTO;
import com.paperharvest.backend.model.dto.TranslationRequestDTO;
import com.paperharvest.backend.model.dto.TranslationSummaryDTO;
import com.paperharvest.backend.model.enums.SiteKind;
import com.paperharvest.backend.scraping.CrawlService;
import com.paperharvest.backend.translation.TranslationService;
import java.nio.file.Path;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs crawl, translate and export once after startup when {@code app.startup.enabled} is set
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineStartupService {

    private final CrawlService crawlService;
    private final TranslationService translationService;
    private final ArticleExporter articleExporter;

    @Value("${app.startup.enabled:false}")
    private boolean enabled;

    @Value("${app.startup.start-url:}")
    private String startUrl;

    @Value("${app.startup.site-kind:}")
    private String siteKind;

    @Value("${app.startup.max-pages:0}")
    private int maxPages;

    @Value("${app.startup.limit-articles:0}")
    private int limitArticles;

    @Value("${app.startup.translate:true}")
    private boolean translate;

    @Value("${app.startup.export-format:}")
    private String exportFormat;

    @Value("${app.startup.export-path:out/articles.csv}")
    private String exportPath;

    @EventListener(ApplicationReadyEvent.class)
    @Async
    public void onApplicationReady() {
        if (!enabled) {
            log.info("🔕 Startup pipeline disabled via configuration");
            return;
        }
        if (startUrl == null || startUrl.isBlank()) {
            log.warn("Startup pipeline enabled but app.startup.start-url is empty, skipping");
            return;
        }
        runPipeline();
    }

    void runPipeline() {
        log.info("🌟 ===== HARVEST PIPELINE STARTED at {} =====", LocalDateTime.now());
        try {
            log.info("🔍 PHASE 1: Crawl {}", startUrl);
            CrawlSummaryDTO crawl = crawlService.crawl(CrawlRequestDTO.builder()
                    .startUrl(startUrl.trim())
                    .siteKind(siteKind == null || siteKind.isBlank() ? null : SiteKind.fromName(siteKind))
                    .maxPages(maxPages)
                    .limitArticles(limitArticles)
                    .build());
            log.info("✅ Crawl finished: {} fetched, {} failed, {} skipped across {} pages",
                    crawl.getFetched(), crawl.getFailed(), crawl.getSkipped(), crawl.getPagesVisited());

            if (translate) {
                log.info("🌐 PHASE 2: Translate");
                TranslationSummaryDTO translation = translationService.translate(new TranslationRequestDTO());
                log.info("✅ Translation finished: {} translated, {} failed",
                        translation.getTranslated(), translation.getFailed());
            }

            if (exportFormat != null && !exportFormat.isBlank()) {
                log.info("💾 PHASE 3: Export to {}", exportPath);
                int count = articleExporter.exportToFile(Path.of(exportPath), ExportFormat.fromName(exportFormat),
                        crawl.getStartUrl());
                log.info("✅ Exported {} records", count);
            }
            log.info("🎉 ===== HARVEST PIPELINE COMPLETED =====");
        } catch (Exception e) {
            log.error("❌ Startup pipeline failed: {}", e.getMessage(), e);
        }
    }
}
