package com.example.audiobookfinder.application.service;

import com.example.audiobookfinder.common.config.AppSearchProperties;
import com.example.audiobookfinder.domain.model.SearchResult;
import com.example.audiobookfinder.domain.model.VideoSearchHit;
import com.example.audiobookfinder.infrastructure.search.VideoSearchProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class AudiobookSearchService {

    private static final Logger log = LoggerFactory.getLogger(AudiobookSearchService.class);

    static final String NOT_AVAILABLE = "N/A";
    private static final String WATCH_URL = "https://www.youtube.com/watch?v=%s";
    private static final String THUMBNAIL_URL = "https://i.ytimg.com/vi/%s/hqdefault.jpg";

    private final VideoSearchProvider videoSearchProvider;
    private final AppSearchProperties properties;
    private final MeterRegistry meterRegistry;
    private final Map<String, CachedResults> cache = new ConcurrentHashMap<>();

    public AudiobookSearchService(VideoSearchProvider videoSearchProvider,
                                  AppSearchProperties properties,
                                  ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.videoSearchProvider = videoSearchProvider;
        this.properties = properties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * Searches the video provider. Provider failures are logged and reported as an empty list.
     */
    public List<SearchResult> search(String query, Integer maxResults) {
        String safeQuery = query == null ? "" : query.trim();
        int limit = normalizeMaxResults(maxResults);
        if (!StringUtils.hasText(safeQuery)) {
            return Collections.emptyList();
        }

        long startedAtNanos = System.nanoTime();
        String cacheKey = safeQuery.toLowerCase(Locale.ROOT) + "|" + limit;
        try {
            List<SearchResult> cached = readCache(cacheKey);
            if (cached != null) {
                recordCounter("audiobook.search.cache.hit");
                return cached;
            }
            recordCounter("audiobook.search.cache.miss");

            List<SearchResult> results;
            try {
                List<VideoSearchHit> hits = videoSearchProvider.search(safeQuery, limit);
                results = toSearchResults(hits, limit);
            } catch (Exception e) {
                log.error("SEARCH_FAILED query={} reason={}", safeQuery, e.getMessage(), e);
                recordCounter("audiobook.search.failed");
                return Collections.emptyList();
            }
            writeCache(cacheKey, results);
            log.info("SEARCH_DONE query={} maxResults={} results={}", safeQuery, limit, results.size());
            return results;
        } finally {
            long elapsedNanos = System.nanoTime() - startedAtNanos;
            recordDuration("audiobook.search.latency", elapsedNanos);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
            if (elapsedMs > properties.getSlowQueryThresholdMs()) {
                log.warn("SEARCH_SLOW query={} costMs={} thresholdMs={}",
                        safeQuery, elapsedMs, properties.getSlowQueryThresholdMs());
            }
        }
    }

    private List<SearchResult> toSearchResults(List<VideoSearchHit> hits, int limit) {
        if (hits == null || hits.isEmpty()) {
            return Collections.emptyList();
        }
        List<SearchResult> results = new ArrayList<>();
        for (VideoSearchHit hit : hits) {
            if (hit == null || !StringUtils.hasText(hit.getId())) {
                continue;
            }
            results.add(new SearchResult(
                    hit.getId(),
                    hit.getTitle(),
                    hit.getChannel(),
                    orNotAvailable(hit.getDuration()),
                    orNotAvailable(hit.getPublishTime()),
                    orNotAvailable(hit.getViewCount()),
                    String.format(WATCH_URL, hit.getId()),
                    String.format(THUMBNAIL_URL, hit.getId())));
            if (results.size() >= limit) {
                break;
            }
        }
        return Collections.unmodifiableList(results);
    }

    private String orNotAvailable(String value) {
        return value == null ? NOT_AVAILABLE : value;
    }

    private int normalizeMaxResults(Integer maxResults) {
        if (maxResults == null || maxResults <= 0) {
            return Math.max(1, properties.getDefaultMaxResults());
        }
        return Math.min(maxResults, Math.max(1, properties.getMaxResultsLimit()));
    }

    private List<SearchResult> readCache(String key) {
        if (properties.getCacheTtlMs() <= 0) {
            return null;
        }
        CachedResults entry = cache.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(System.currentTimeMillis(), properties.getCacheTtlMs())) {
            cache.remove(key, entry);
            return null;
        }
        return entry.results;
    }

    private void writeCache(String key, List<SearchResult> results) {
        if (properties.getCacheTtlMs() <= 0 || properties.getCacheMaxEntries() <= 0) {
            return;
        }
        long now = System.currentTimeMillis();
        if (cache.size() >= properties.getCacheMaxEntries()) {
            cache.entrySet().removeIf(entry -> entry.getValue().isExpired(now, properties.getCacheTtlMs()));
            if (cache.size() >= properties.getCacheMaxEntries()) {
                cache.clear();
            }
        }
        cache.put(key, new CachedResults(results, now));
    }

    private void recordCounter(String name) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name).increment();
        } catch (Exception e) {
            log.debug("Search metric counter failed, name={}", name, e);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Search metric timer failed, name={}", name, e);
        }
    }

    private static final class CachedResults {

        private final List<SearchResult> results;
        private final long createdAtMs;

        private CachedResults(List<SearchResult> results, long createdAtMs) {
            this.results = results;
            this.createdAtMs = createdAtMs;
        }

        private boolean isExpired(long now, long ttlMs) {
            return now - createdAtMs > ttlMs;
        }
    }
}
