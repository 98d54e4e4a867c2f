package com.goormthonuniv.modelsearch.model;

import com.goormthonuniv.modelsearch.search.Source;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 캐시 단위. listings 는 {@link Source} 순서로 묶여 있고 sourceCounts 는 항상 그 묶음의 크기와 같다.
 */
public record QueryResult(
        String normalizedQuery,
        List<Listing> listings,
        Map<Source, Integer> sourceCounts,
        Instant updatedAt
) {

    public QueryResult {
        listings = List.copyOf(listings);
        EnumMap<Source, Integer> counts = new EnumMap<>(Source.class);
        counts.putAll(sourceCounts);
        sourceCounts = Collections.unmodifiableMap(counts);
    }

    /** listings 로부터 소스별 개수를 다시 계산해서 만든다. 결과가 없는 소스는 0. */
    public static QueryResult of(String normalizedQuery, List<Listing> listings, Instant updatedAt) {
        return new QueryResult(normalizedQuery, listings, countBySource(listings), updatedAt);
    }

    public static Map<Source, Integer> countBySource(List<Listing> listings) {
        EnumMap<Source, Integer> counts = new EnumMap<>(Source.class);
        for (Source s : Source.values()) counts.put(s, 0);
        for (Listing l : listings) counts.merge(l.source(), 1, Integer::sum);
        return counts;
    }

    public int count(Source source) {
        return sourceCounts.getOrDefault(source, 0);
    }

    public List<Listing> listingsOf(Source source) {
        return listings.stream().filter(l -> l.source() == source).toList();
    }

    /** 직전 시도에서 결과가 0건이었던 소스 (= 부분 갱신 대상) */
    public Set<Source> staleSources() {
        Set<Source> stale = EnumSet.noneOf(Source.class);
        for (Source s : Source.values()) {
            if (count(s) <= 0) stale.add(s);
        }
        return stale;
    }

    public boolean isComplete() {
        return staleSources().isEmpty();
    }
}
