package com.paperharvest.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrawlSummaryDTO {
    private String startUrl;
    private String siteKind;
    private int pagesVisited;
    private int discovered;
    private int fetched;
    private int failed;
    private int skipped;
    // Set when pagination stopped early, articles found before it stay valid
    private String traversalError;
    private boolean cancelled;
    private String startedAt;
    private String completedAt;
    private Double durationSeconds;
}
