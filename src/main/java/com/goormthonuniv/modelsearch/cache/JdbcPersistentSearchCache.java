package com.goormthonuniv.modelsearch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.modelsearch.model.Listing;
import com.goormthonuniv.modelsearch.model.QueryResult;
import com.goormthonuniv.modelsearch.search.Source;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * searches 테이블 기반 구현. listings/sources 는 JSON 문자열 컬럼에 저장한다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcPersistentSearchCache implements PersistentSearchCache {

    private static final TypeReference<List<Listing>> LISTINGS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Integer>> COUNTS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Optional<QueryResult> get(String normalizedQuery) {
        List<QueryResult> rows = jdbcTemplate.query(
                "SELECT query, results, sources, updated_at FROM searches WHERE query = ?",
                (rs, i) -> mapRow(rs),
                normalizedQuery);
        return rows.stream().findFirst();
    }

    @Override
    public QueryResult put(String normalizedQuery, List<Listing> listings, Map<Source, Integer> sourceCounts) {
        Instant now = clock.instant();
        Timestamp ts = Timestamp.from(now);
        String results = write(listings);
        String sources = write(toKeyed(sourceCounts));

        int updated = update(normalizedQuery, results, sources, ts);
        if (updated == 0) {
            try {
                jdbcTemplate.update(
                        "INSERT INTO searches (query, results, sources, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                        normalizedQuery, results, sources, ts, ts);
            } catch (DuplicateKeyException race) {
                // 동시 insert 경합: 나중 쓰기가 이긴다
                update(normalizedQuery, results, sources, ts);
            }
        }
        return new QueryResult(normalizedQuery, listings, sourceCounts, now);
    }

    @Override
    public int prune(Duration maxAge) {
        Timestamp cutoff = Timestamp.from(clock.instant().minus(maxAge));
        return jdbcTemplate.update("DELETE FROM searches WHERE updated_at < ?", cutoff);
    }

    @Override
    public CacheStats stats() {
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS cnt, MAX(updated_at) AS last_update FROM searches",
                (rs, i) -> {
                    Timestamp last = rs.getTimestamp("last_update");
                    return new CacheStats(rs.getLong("cnt"), last == null ? null : last.toInstant());
                });
    }

    // ===================== 내부 유틸 =====================

    private int update(String query, String results, String sources, Timestamp ts) {
        return jdbcTemplate.update(
                "UPDATE searches SET results = ?, sources = ?, updated_at = ? WHERE query = ?",
                results, sources, ts, query);
    }

    private QueryResult mapRow(ResultSet rs) throws SQLException {
        String query = rs.getString("query");
        List<Listing> listings = read(rs.getString("results"), LISTINGS);
        Map<Source, Integer> counts = new EnumMap<>(Source.class);
        for (Map.Entry<String, Integer> e : read(rs.getString("sources"), COUNTS).entrySet()) {
            try {
                counts.put(Source.fromKey(e.getKey()), e.getValue() == null ? 0 : e.getValue());
            } catch (IllegalArgumentException unknown) {
                log.debug("[ModelSearch] ignoring unknown source '{}' in cached row query=\"{}\"", e.getKey(), query);
            }
        }
        // 저장된 개수는 실제 listings 개수를 넘을 수 없다. 0 은 그대로 두어 다음 요청에서 갱신되게 한다
        Map<Source, Integer> actual = QueryResult.countBySource(listings);
        for (Source s : Source.values()) {
            counts.put(s, Math.min(counts.getOrDefault(s, 0), actual.get(s)));
        }
        return new QueryResult(query, listings, counts, rs.getTimestamp("updated_at").toInstant());
    }

    private static Map<String, Integer> toKeyed(Map<Source, Integer> counts) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Source s : Source.values()) {
            out.put(s.key(), counts.getOrDefault(s, 0));
        }
        return out;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize cache payload", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("corrupted cache payload", e);
        }
    }
}
