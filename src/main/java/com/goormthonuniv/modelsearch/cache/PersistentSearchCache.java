package com.goormthonuniv.modelsearch.cache;

import com.goormthonuniv.modelsearch.model.Listing;
import com.goormthonuniv.modelsearch.model.QueryResult;
import com.goormthonuniv.modelsearch.search.Source;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 재시작 후에도 남는 2차 캐시. 검색어당 레코드 1개.
 * 구현체는 저장소 오류를 그대로 던지고, 흡수는 호출자(집계기)가 한다.
 */
public interface PersistentSearchCache {

    Optional<QueryResult> get(String normalizedQuery);

    /** upsert. listings/sourceCounts 를 교체하고 updatedAt 을 갱신한다. 생성 시각은 유지. */
    QueryResult put(String normalizedQuery, List<Listing> listings, Map<Source, Integer> sourceCounts);

    /** updatedAt 이 maxAge 보다 오래된 레코드를 지우고 지운 개수를 돌려준다. */
    int prune(Duration maxAge);

    CacheStats stats();

    record CacheStats(long totalSearches, Instant lastUpdate) {}
}
