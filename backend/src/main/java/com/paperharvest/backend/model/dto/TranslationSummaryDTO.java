package com.paperharvest.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranslationSummaryDTO {
    private String model;
    private int pending;
    private int translated;
    private int failed;
    // Translations reused from a row with the same abstract
    private int cached;
    private int glossaryTermsAdded;
    private boolean cancelled;
    private String startedAt;
    private String completedAt;
    private Double durationSeconds;
}
