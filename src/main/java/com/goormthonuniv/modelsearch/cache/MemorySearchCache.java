package com.goormthonuniv.modelsearch.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.modelsearch.config.SearchProperties;
import com.goormthonuniv.modelsearch.model.QueryResult;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 프로세스 수명 동안만 유지되는 1차 캐시 (정규화 검색어 → 결과).
 */
@Component
public class MemorySearchCache {

    private final Cache<String, QueryResult> cache;

    public MemorySearchCache(SearchProperties properties) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getMemoryTtl())
                .maximumSize(properties.getCache().getMemoryMaxSize())
                .build();
    }

    public Optional<QueryResult> get(String normalizedQuery) {
        return Optional.ofNullable(cache.getIfPresent(normalizedQuery));
    }

    public void put(String normalizedQuery, QueryResult result) {
        cache.put(normalizedQuery, result);
    }

    public void invalidate(String normalizedQuery) {
        cache.invalidate(normalizedQuery);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
