package com.paperharvest.backend.translation;

import com.paperharvest.backend.article.StorageException;
import com.paperharvest.backend.model.dto.TaskStatusDTO;
import com.paperharvest.backend.model.dto.TranslationRequestDTO;
import com.paperharvest.backend.model.dto.TranslationSummaryDTO;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
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
 * REST controller for translate runs and the term glossary
 */
@RestController
@RequestMapping("/api/translation")
@RequiredArgsConstructor
@Slf4j
@Validated
public class TranslationController {

    private final TranslationService translationService;

    /**
     * Translate all pending abstracts synchronously
     */
    @PostMapping
    public ResponseEntity<?> translate(@Valid @RequestBody(required = false) TranslationRequestDTO request) {
        TranslationRequestDTO effective = request != null ? request : new TranslationRequestDTO();
        try {
            TranslationSummaryDTO summary = translationService.translate(effective);
            return ResponseEntity.ok(Map.of(
                    "message", "Translation completed",
                    "summary", summary
            ));
        } catch (StorageException e) {
            log.error("Article store unavailable for translation", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Article store unavailable: " + e.getMessage()));
        } catch (Exception e) {
            log.error("Error during translation", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Translation failed: " + e.getMessage()));
        }
    }

    /**
     * Start a translate run in the background
     */
    @PostMapping("/async")
    public ResponseEntity<?> translateAsync(@Valid @RequestBody(required = false) TranslationRequestDTO request) {
        TranslationRequestDTO effective = request != null ? request : new TranslationRequestDTO();
        try {
            String taskId = translationService.registerTask();
            translationService.translateAsync(taskId, effective);
            return ResponseEntity.accepted().body(Map.of(
                    "message", "Async translation started",
                    "taskId", taskId,
                    "status", "RUNNING",
                    "checkStatusAt", "/api/translation/status/" + taskId
            ));
        } catch (Exception e) {
            log.error("Error starting async translation", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to start translation: " + e.getMessage()));
        }
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, TaskStatusDTO>> getAllTaskStatuses() {
        return ResponseEntity.ok(translationService.getAllTaskStatuses());
    }

    @GetMapping("/status/{taskId}")
    public ResponseEntity<?> getTaskStatus(@PathVariable String taskId) {
        TaskStatusDTO status = translationService.getTaskStatus(taskId);
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    @PostMapping("/status/{taskId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String taskId) {
        if (!translationService.cancel(taskId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No running translation task " + taskId));
        }
        return ResponseEntity.ok(Map.of("message", "Cancellation requested", "taskId", taskId));
    }

    /**
     * Terms whose Chinese rendering has been fixed, in first-seen order
     */
    @GetMapping("/glossary")
    public ResponseEntity<?> getGlossary() {
        List<GlossaryTerm> terms = translationService.getGlossary();
        Map<String, String> renderings = new LinkedHashMap<>();
        terms.forEach(t -> renderings.put(t.getSourceTerm(), t.getRendering()));
        return ResponseEntity.ok(Map.of("count", terms.size(), "terms", renderings));
    }
}
