package com.goormthonuniv.modelsearch.cache;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import com.goormthonuniv.modelsearch.model.QueryResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemorySearchCacheTest {

    @Test
    void put_shouldOverwriteExistingEntry() {
        MemorySearchCache cache = new MemorySearchCache(new SearchProperties());
        QueryResult first = QueryResult.of("gear", List.of(), Instant.now());
        QueryResult second = QueryResult.of("gear", List.of(), Instant.now().plusSeconds(1));

        cache.put("gear", first);
        cache.put("gear", second);

        assertSame(second, cache.get("gear").orElseThrow());
        assertEquals(1, cache.size());
    }

    @Test
    void get_shouldMissAfterTtl() throws InterruptedException {
        SearchProperties properties = new SearchProperties();
        properties.getCache().setMemoryTtl(Duration.ofMillis(50));
        MemorySearchCache cache = new MemorySearchCache(properties);

        cache.put("gear", QueryResult.of("gear", List.of(), Instant.now()));
        Thread.sleep(120);

        assertTrue(cache.get("gear").isEmpty());
    }

    @Test
    void invalidate_shouldRemoveEntry() {
        MemorySearchCache cache = new MemorySearchCache(new SearchProperties());
        cache.put("gear", QueryResult.of("gear", List.of(), Instant.now()));

        cache.invalidate("gear");

        assertTrue(cache.get("gear").isEmpty());
    }
}
