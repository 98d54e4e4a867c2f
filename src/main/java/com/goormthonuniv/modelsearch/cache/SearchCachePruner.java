package com.goormthonuniv.modelsearch.cache;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 보관 기간이 지난 캐시 레코드 정리. 기동 직후 한 번, 이후 주기적으로.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchCachePruner implements ApplicationRunner {

    private final PersistentSearchCache persistentCache;
    private final SearchProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        prune();
    }

    @Scheduled(
            initialDelayString = "${modelsearch.cache.prune-interval:PT6H}",
            fixedDelayString = "${modelsearch.cache.prune-interval:PT6H}")
    public void scheduledPrune() {
        prune();
    }

    public int prune() {
        try {
            int removed = persistentCache.prune(properties.getCache().getRetention());
            log.info("[ModelSearch] pruned {} cached searches older than {}", removed, properties.getCache().getRetention());
            return removed;
        } catch (DataAccessException e) {
            log.error("[ModelSearch] cache prune failed: {}", e.getMessage());
            return 0;
        }
    }
}
