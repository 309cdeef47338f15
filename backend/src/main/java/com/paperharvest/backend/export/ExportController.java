package com.paperharvest.backend.export;

import com.paperharvest.backend.article.StorageException;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
@Slf4j
public class ExportController {

    private final ArticleExporter articleExporter;

    /**
     * Download stored articles as a CSV or JSONL attachment
     */
    @GetMapping
    public ResponseEntity<?> export(@RequestParam(defaultValue = "csv") String format,
                                    @RequestParam(required = false) String searchUrl) {
        ExportFormat exportFormat;
        try {
            exportFormat = ExportFormat.fromName(format);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        try {
            StringWriter writer = new StringWriter();
            int count = articleExporter.export(writer, exportFormat, searchUrl);
            log.info("Serving export of {} records as {}", count, exportFormat.getExtension());
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename=\"articles." + exportFormat.getExtension() + "\"")
                    .contentType(new MediaType(MediaType.parseMediaType(exportFormat.getContentType()),
                            StandardCharsets.UTF_8))
                    .body(writer.toString().getBytes(StandardCharsets.UTF_8));
        } catch (StorageException e) {
            log.error("Article store unavailable for export", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Article store unavailable: " + e.getMessage()));
        } catch (IOException e) {
            log.error("Error writing export", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Export failed: " + e.getMessage()));
        }
    }
}
