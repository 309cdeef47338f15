package com.paperharvest.backend.config;

import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "harvest.crawl")
@Data
public class CrawlConfig {

    // Worker pool and throttle defaults, overridable per request
    private int concurrency = 3;
    private double rate = 1.5;
    private int burst = 1;

    // Per-request timeout in seconds
    private int timeout = 30;

    // Retry policy for listing and article pages
    private int maxAttempts = 4;
    private long baseDelayMillis = 1000;
    private double jitter = 0.5;

    // 0 means no cap
    private int maxPages = 0;
    private int limitArticles = 0;

    // Skip articles that already have an English abstract stored
    private boolean resume = true;

    // Default headers for HTTP requests
    private Map<String, String> defaultHeaders = Map.of(
            "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.9"
    );
}
