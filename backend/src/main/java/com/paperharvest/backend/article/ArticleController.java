package com.paperharvest.backend.article;

import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.model.enums.ArticleStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/articles")
@RequiredArgsConstructor
@Slf4j
@Validated
public class ArticleController {

    static final Set<String> SORTABLE_FIELDS = Set.of("id", "articleUrl", "searchUrl", "title", "journal",
            "publishedDate", "status", "crawledAt", "translatedAt", "createdAt", "updatedAt");

    private final ArticleStore articleStore;

    private Pageable createPageable(int page, int size, String sortBy, String sortDir) {
        Sort sort = sortDir.equalsIgnoreCase("desc") ?
                Sort.by(sortBy).descending() :
                Sort.by(sortBy).ascending();
        return PageRequest.of(page, size, sort);
    }

    /**
     * Stored articles, optionally filtered by pipeline status
     */
    @GetMapping
    public ResponseEntity<?> getArticles(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size,
            @RequestParam(defaultValue = "id") String sortBy,
            @RequestParam(defaultValue = "asc") String sortDir) {
        ArticleStatus filter;
        try {
            filter = status == null || status.isBlank() ? null : ArticleStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
        }
        if (!SORTABLE_FIELDS.contains(sortBy)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Cannot sort by: " + sortBy));
        }
        try {
            Page<Article> articles = articleStore.list(filter, createPageable(page, size, sortBy, sortDir));
            return ResponseEntity.ok(articles);
        } catch (StorageException e) {
            log.error("Failed to list articles", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Row counts per status
     */
    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        try {
            Map<ArticleStatus, Long> counts = articleStore.countByStatus();
            long total = counts.values().stream().mapToLong(Long::longValue).sum();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("total", total);
            body.put("byStatus", counts);
            return ResponseEntity.ok(body);
        } catch (StorageException e) {
            log.error("Failed to count articles", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/lookup")
    public ResponseEntity<?> lookup(@RequestParam String url) {
        return articleStore.find(url)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
