package com.goormthonuniv.modelsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "modelsearch")
@Data
public class SearchProperties {

    private Search search = new Search();
    private Cache cache = new Cache();
    private Fetcher fetcher = new Fetcher();

    @Data
    public static class Search {
        /** 어댑터 호출 1회당 시간 예산. 넘기면 해당 소스는 0건 처리 */
        private Duration adapterTimeout = Duration.ofSeconds(20);
        private int maxResultsPerSource = 10;
        private int fetchPoolSize = 8;
    }

    @Data
    public static class Cache {
        private Duration memoryTtl = Duration.ofHours(1);
        private long memoryMaxSize = 2000;
        private Duration retention = Duration.ofDays(7);
        private Duration pruneInterval = Duration.ofHours(6);
    }

    @Data
    public static class Fetcher {
        private int maxConcurrentPages = 4;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    }
}
