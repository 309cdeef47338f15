package com.paperharvest.backend.scraping;

import com.paperharvest.backend.article.StorageException;
import com.paperharvest.backend.model.dto.CrawlRequestDTO;
import com.paperharvest.backend.model.dto.CrawlSummaryDTO;
import com.paperharvest.backend.model.dto.TaskStatusDTO;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for crawl runs
 */
@RestController
@RequestMapping("/api/crawl")
@RequiredArgsConstructor
@Slf4j
@Validated
public class CrawlController {

    private final CrawlService crawlService;

    /**
     * Crawl a listing synchronously and return the run summary
     */
    @PostMapping
    public ResponseEntity<?> crawl(@Valid @RequestBody CrawlRequestDTO request) {
        try {
            CrawlSummaryDTO summary = crawlService.crawl(request);
            return ResponseEntity.ok(Map.of(
                    "message", "Crawl completed",
                    "summary", summary
            ));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (StorageException e) {
            log.error("Article store unavailable for crawl of {}", request.getStartUrl(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Article store unavailable: " + e.getMessage()));
        } catch (Exception e) {
            log.error("Error during crawl of {}", request.getStartUrl(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Crawl failed: " + e.getMessage()));
        }
    }

    /**
     * Start a crawl in the background
     */
    @PostMapping("/async")
    public ResponseEntity<?> crawlAsync(@Valid @RequestBody CrawlRequestDTO request) {
        try {
            String taskId = crawlService.registerTask();
            crawlService.crawlAsync(taskId, request);
            return ResponseEntity.accepted().body(Map.of(
                    "message", "Async crawl started",
                    "taskId", taskId,
                    "status", "RUNNING",
                    "checkStatusAt", "/api/crawl/status/" + taskId
            ));
        } catch (Exception e) {
            log.error("Error starting async crawl of {}", request.getStartUrl(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to start crawl: " + e.getMessage()));
        }
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, TaskStatusDTO>> getAllTaskStatuses() {
        return ResponseEntity.ok(crawlService.getAllTaskStatuses());
    }

    @GetMapping("/status/{taskId}")
    public ResponseEntity<?> getTaskStatus(@PathVariable String taskId) {
        TaskStatusDTO status = crawlService.getTaskStatus(taskId);
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    @PostMapping("/status/{taskId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String taskId) {
        if (!crawlService.cancel(taskId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No running crawl task " + taskId));
        }
        return ResponseEntity.ok(Map.of("message", "Cancellation requested", "taskId", taskId));
    }
}
