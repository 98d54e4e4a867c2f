package com.goormthonuniv.modelsearch.service;

import com.goormthonuniv.modelsearch.cache.MemorySearchCache;
import com.goormthonuniv.modelsearch.cache.PersistentSearchCache;
import com.goormthonuniv.modelsearch.config.SearchProperties;
import com.goormthonuniv.modelsearch.exception.InvalidQueryException;
import com.goormthonuniv.modelsearch.model.Listing;
import com.goormthonuniv.modelsearch.model.QueryResult;
import com.goormthonuniv.modelsearch.search.Source;
import com.goormthonuniv.modelsearch.search.SourceAdapter;
import com.goormthonuniv.modelsearch.util.QueryNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 검색어 하나를 캐시 또는 어댑터 조회로 해석한다.
 *
 * <ul>
 *   <li>메모리 캐시에 완전한 레코드가 있으면 그대로 반환</li>
 *   <li>영속 캐시에 모든 소스가 1건 이상이면 메모리 캐시를 채우고 반환</li>
 *   <li>0건 소스가 있으면 그 소스만 다시 조회하고 나머지는 캐시 결과를 재사용</li>
 *   <li>캐시에 없으면 모든 소스 조회</li>
 * </ul>
 *
 * 같은 검색어에 대한 조회는 동시에 하나만 돈다. 늦게 온 요청은 진행 중인 조회의 결과를 기다린다.
 */
@Slf4j
@Service
public class AggregationCoordinator {

    private final Map<Source, SourceAdapter> adapters;
    private final ListingNormalizer normalizer;
    private final MemorySearchCache memoryCache;
    private final PersistentSearchCache persistentCache;
    private final SearchProperties properties;
    private final ExecutorService fetchExecutor;
    private final ExecutorService aggregationExecutor;
    private final Clock clock;

    // 검색어별 진행 중인 조회
    private final ConcurrentHashMap<String, CompletableFuture<Resolution>> inFlight = new ConcurrentHashMap<>();

    public AggregationCoordinator(List<SourceAdapter> adapters,
                                  ListingNormalizer normalizer,
                                  MemorySearchCache memoryCache,
                                  PersistentSearchCache persistentCache,
                                  SearchProperties properties,
                                  @Qualifier("sourceFetchExecutor") ExecutorService fetchExecutor,
                                  @Qualifier("aggregationExecutor") ExecutorService aggregationExecutor,
                                  Clock clock) {
        EnumMap<Source, SourceAdapter> bySource = new EnumMap<>(Source.class);
        for (SourceAdapter a : adapters) {
            SourceAdapter prev = bySource.putIfAbsent(a.source(), a);
            if (prev != null) {
                throw new IllegalStateException("duplicate adapter for source " + a.source().key());
            }
        }
        this.adapters = Collections.unmodifiableMap(bySource);
        this.normalizer = normalizer;
        this.memoryCache = memoryCache;
        this.persistentCache = persistentCache;
        this.properties = properties;
        this.fetchExecutor = fetchExecutor;
        this.aggregationExecutor = aggregationExecutor;
        this.clock = clock;
    }

    /** 메인 엔트리 */
    public Resolution resolve(String rawQuery) {
        final String key = QueryNormalizer.normalize(rawQuery);
        if (key.isEmpty()) {
            throw new InvalidQueryException("Query parameter required");
        }
        trace(key, ResolutionState.UNRESOLVED);

        Optional<QueryResult> hot = memoryCache.get(key);
        if (hot.isPresent() && hot.get().isComplete()) {
            log.info("[ModelSearch] query=\"{}\" served from memory", key);
            return new Resolution(hot.get(), ResolutionState.FRESH_HIT, Set.of());
        }
        return await(key, joinOrStart(key));
    }

    public Set<Source> registeredSources() {
        return adapters.keySet();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    // ===================== single-flight =====================

    private CompletableFuture<Resolution> joinOrStart(String key) {
        CompletableFuture<Resolution> mine = new CompletableFuture<>();
        CompletableFuture<Resolution> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.info("[ModelSearch] query=\"{}\" attached to in-flight fetch", key);
            return existing;
        }
        try {
            // 호출자 스레드와 분리: 요청이 끊겨도 조회는 끝까지 돌고 캐시에 남는다
            aggregationExecutor.execute(() -> {
                Resolution resolution = null;
                Throwable failure = null;
                try {
                    resolution = resolveUncached(key);
                } catch (Throwable t) {
                    log.error("[ModelSearch] query=\"{}\" aggregation failed", key, t);
                    failure = t;
                } finally {
                    // 캐시 기록이 끝난 뒤 해제. 이후 요청은 캐시에서 받는다
                    inFlight.remove(key, mine);
                }
                if (failure != null) {
                    mine.completeExceptionally(failure);
                } else {
                    mine.complete(resolution);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(e);
        }
        return mine;
    }

    private Resolution await(String key, CompletableFuture<Resolution> flight) {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for query \"" + key + "\"", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("aggregation failed for query \"" + key + "\"", cause);
        }
    }

    // ===================== 캐시 판정 + 조회 =====================

    private Resolution resolveUncached(String key) {
        trace(key, ResolutionState.CACHE_CHECK);

        // 앞선 조회가 방금 끝났을 수 있다
        Optional<QueryResult> hot = memoryCache.get(key);
        if (hot.isPresent() && hot.get().isComplete()) {
            return new Resolution(hot.get(), ResolutionState.FRESH_HIT, Set.of());
        }

        Optional<QueryResult> stored = readPersistent(key);
        if (stored.isPresent() && stored.get().isComplete()) {
            log.info("[ModelSearch] query=\"{}\" served from database (updatedAt={})", key, stored.get().updatedAt());
            memoryCache.put(key, stored.get());
            return new Resolution(stored.get(), ResolutionState.FRESH_HIT, Set.of());
        }

        QueryResult base = stored.orElse(hot.orElse(null));
        ResolutionState path;
        Set<Source> targets;
        if (base == null) {
            path = ResolutionState.FULL_FETCH;
            targets = EnumSet.allOf(Source.class);
        } else {
            path = ResolutionState.PARTIAL_REFRESH;
            targets = base.staleSources();
        }
        trace(key, path);
        log.info("[ModelSearch] query=\"{}\" {} sources={}", key, path, targets);

        Map<Source, List<Listing>> fetched = fetchAll(key, targets);

        trace(key, ResolutionState.MERGING);
        List<Listing> merged = new ArrayList<>();
        for (Source s : Source.values()) {
            merged.addAll(targets.contains(s) ? fetched.getOrDefault(s, List.of()) : base.listingsOf(s));
        }
        Map<Source, Integer> counts = QueryResult.countBySource(merged);

        QueryResult result = persist(key, merged, counts);
        trace(key, ResolutionState.PERSISTED);

        log.info("[ModelSearch] query=\"{}\" total={} sources={}", key, merged.size(), counts);
        trace(key, ResolutionState.DONE);
        return new Resolution(result, path, Collections.unmodifiableSet(targets));
    }

    /** 선택된 소스를 동시에 조회하고 전부 끝날 때까지 기다린다. 실패/시간 초과 소스는 빈 목록. */
    private Map<Source, List<Listing>> fetchAll(String query, Set<Source> targets) {
        long budgetMs = properties.getSearch().getAdapterTimeout().toMillis();
        Map<Source, CompletableFuture<List<Listing>>> futures = new EnumMap<>(Source.class);

        for (Source s : targets) {
            SourceAdapter adapter = adapters.get(s);
            if (adapter == null) {
                log.warn("[ModelSearch] no adapter registered for source={}", s.key());
                futures.put(s, CompletableFuture.completedFuture(List.of()));
                continue;
            }
            CompletableFuture<List<Listing>> f;
            try {
                f = CompletableFuture
                        .supplyAsync(() -> normalizer.normalize(s, adapter.fetch(query)), fetchExecutor)
                        .orTimeout(budgetMs, TimeUnit.MILLISECONDS)
                        .exceptionally(ex -> {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                            if (cause instanceof TimeoutException) {
                                log.warn("[ModelSearch] source={} timed out after {}ms", s.key(), budgetMs);
                            } else {
                                log.warn("[ModelSearch] source={} failed: {}", s.key(), cause.toString());
                            }
                            return List.of();
                        });
            } catch (RejectedExecutionException e) {
                log.warn("[ModelSearch] source={} rejected by fetch pool", s.key());
                f = CompletableFuture.completedFuture(List.of());
            }
            futures.put(s, f);
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<Source, List<Listing>> out = new EnumMap<>(Source.class);
        futures.forEach((s, f) -> out.put(s, f.join()));
        return out;
    }

    // ===================== 캐시 I/O (실패는 흡수) =====================

    private Optional<QueryResult> readPersistent(String key) {
        try {
            return persistentCache.get(key);
        } catch (RuntimeException e) {
            log.warn("[ModelSearch] query=\"{}\" cache read failed, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private QueryResult persist(String key, List<Listing> listings, Map<Source, Integer> counts) {
        QueryResult result;
        try {
            result = persistentCache.put(key, listings, counts);
        } catch (RuntimeException e) {
            log.error("[ModelSearch] query=\"{}\" cache write failed: {}", key, e.getMessage());
            result = new QueryResult(key, listings, counts, clock.instant());
        }
        memoryCache.put(key, result);
        return result;
    }

    private static void trace(String key, ResolutionState state) {
        log.debug("[ModelSearch] query=\"{}\" state={}", key, state);
    }
}
