package com.example.audiobookfinder.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.search")
public class AppSearchProperties {

    private String baseUrl = "https://www.youtube.com";

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private String acceptLanguage = "en-US,en;q=0.9";

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 10000;

    private int defaultMaxResults = 10;

    /**
     * Upper bound applied to the caller supplied maxResults.
     */
    private int maxResultsLimit = 50;

    /**
     * Slow query threshold used for structured outlier logging.
     */
    private long slowQueryThresholdMs = 3000L;

    /**
     * In-memory result cache TTL to absorb repeated search clicks.
     */
    private long cacheTtlMs = 60000L;

    /**
     * Max cache entries for search result snapshots.
     */
    private int cacheMaxEntries = 128;
}
