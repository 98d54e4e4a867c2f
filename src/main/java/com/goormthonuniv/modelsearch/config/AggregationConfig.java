package com.goormthonuniv.modelsearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AggregationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** 어댑터 호출(소스별 fan-out) 전용 풀 */
    @Bean(name = "sourceFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService sourceFetchExecutor(SearchProperties properties) {
        return Executors.newFixedThreadPool(
                Math.max(1, properties.getSearch().getFetchPoolSize()), named("source-fetch-"));
    }

    /** 쿼리 단위 집계 작업. 호출자 스레드와 분리해서 요청이 끊겨도 집계는 끝까지 돈다 */
    @Bean(name = "aggregationExecutor", destroyMethod = "shutdown")
    public ExecutorService aggregationExecutor() {
        return Executors.newCachedThreadPool(named("aggregate-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
