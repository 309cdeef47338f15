package com.paperharvest.backend.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "harvest.translation")
@Data
public class TranslationConfig {

    private String model = "deepseek-chat";
    private double temperature = 0.2;
    private String targetLanguage = "简体中文";

    private int concurrency = 3;
    private double rate = 1.5;
    private int burst = 1;

    // Retry policy for rate-limited or failing model calls
    private int maxAttempts = 4;
    private long baseDelayMillis = 2000;
    private double jitter = 0.5;

    // 0 means every pending article
    private int maxItems = 0;

    // Vocabulary handed to the term segmenter, longest match wins
    private List<String> terms = new ArrayList<>();
    private boolean detectAcronyms = true;
}
