package com.goormthonuniv.modelsearch.dto;

import java.time.Instant;
import java.util.List;

public record HealthResponse(
        String status,
        List<String> scrapers,
        boolean fetcherRunning,
        long memoryEntries,
        CacheStatsView cacheStats
) {
    public record CacheStatsView(long totalSearches, Instant lastUpdate) {}
}
