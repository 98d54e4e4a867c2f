package com.goormthonuniv.modelsearch.service;

import com.goormthonuniv.modelsearch.cache.MemorySearchCache;
import com.goormthonuniv.modelsearch.cache.PersistentSearchCache;
import com.goormthonuniv.modelsearch.dto.HealthResponse;
import com.goormthonuniv.modelsearch.search.PageFetcher;
import com.goormthonuniv.modelsearch.search.Source;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchHealthService {

    private final AggregationCoordinator coordinator;
    private final MemorySearchCache memoryCache;
    private final PersistentSearchCache persistentCache;
    private final PageFetcher pageFetcher;

    public HealthResponse health() {
        HealthResponse.CacheStatsView stats;
        try {
            PersistentSearchCache.CacheStats s = persistentCache.stats();
            stats = new HealthResponse.CacheStatsView(s.totalSearches(), s.lastUpdate());
        } catch (RuntimeException e) {
            log.warn("[ModelSearch] cache stats unavailable: {}", e.getMessage());
            stats = new HealthResponse.CacheStatsView(0, null);
        }
        return new HealthResponse(
                "ok",
                coordinator.registeredSources().stream().map(Source::key).toList(),
                pageFetcher.isRunning(),
                memoryCache.size(),
                stats
        );
    }
}
