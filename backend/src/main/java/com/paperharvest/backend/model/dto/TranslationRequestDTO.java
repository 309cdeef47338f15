package com.paperharvest.backend.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Translate run parameters. Null fields fall back to {@code harvest.translation.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationRequestDTO {
    private String model;

    @Min(1)
    @Max(32)
    private Integer concurrency;

    private Double rate;

    @Min(0)
    private Integer maxItems;
}
