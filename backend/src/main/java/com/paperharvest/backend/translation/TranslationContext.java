package com.paperharvest.backend.translation;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What the translate capability needs to know besides the text: the model, the target
 * language and how each detected term must be rendered
 */
@Data
@AllArgsConstructor
public class TranslationContext {
    private String model;
    private String targetLanguage;
    // Introduced by this abstract: English（中文） at first use
    private List<String> bilingualTerms;
    // Introduced elsewhere: English only
    private List<String> monolingualTerms;
}
