package com.paperharvest.backend.model.dto;

import com.paperharvest.backend.model.enums.SiteKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Crawl run parameters. Null numeric fields fall back to {@code harvest.crawl.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlRequestDTO {
    @NotBlank
    private String startUrl;

    // Inferred from the start URL when absent
    private SiteKind siteKind;

    @Min(1)
    @Max(32)
    private Integer concurrency;

    private Double rate;

    @Min(0)
    private Integer maxPages;

    @Min(0)
    private Integer limitArticles;

    private Boolean resume;
}
