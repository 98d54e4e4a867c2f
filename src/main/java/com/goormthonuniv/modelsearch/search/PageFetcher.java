package com.goormthonuniv.modelsearch.search;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 모든 어댑터가 공유하는 페이지 로더. 기동 시 한 번 초기화되고 종료 시 해제된다.
 * 동시에 열 수 있는 페이지 수를 제한해서 대상 사이트의 차단을 피한다.
 */
@Slf4j
@Component
public class PageFetcher {

    private final RestClient rest;
    private final SearchProperties.Fetcher settings;

    private Semaphore pages;
    private volatile boolean running;

    public PageFetcher(RestClient rest, SearchProperties properties) {
        this.rest = rest;
        this.settings = properties.getFetcher();
    }

    @PostConstruct
    public void start() {
        pages = new Semaphore(Math.max(1, settings.getMaxConcurrentPages()), true);
        running = true;
        log.info("[ModelSearch] page fetcher started (maxConcurrentPages={})", settings.getMaxConcurrentPages());
    }

    @PreDestroy
    public void stop() {
        running = false;
        log.info("[ModelSearch] page fetcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 페이지를 받아 base URI 가 설정된 Jsoup 문서로 돌려준다.
     * 슬롯을 read timeout 안에 얻지 못하면 {@link TimeoutException}.
     */
    public Document load(String url) throws InterruptedException, TimeoutException {
        if (!running) throw new IllegalStateException("page fetcher is not running");

        long waitMs = settings.getReadTimeout().toMillis();
        if (!pages.tryAcquire(waitMs, TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("no free page slot within " + waitMs + "ms");
        }
        try {
            byte[] body = rest.get()
                    .uri(URI.create(url))
                    .header(HttpHeaders.USER_AGENT, settings.getUserAgent())
                    .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                    .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8")
                    .retrieve()
                    .body(byte[].class);
            // charset 은 jsoup 이 헤더/meta 에서 판별
            return Jsoup.parse(new ByteArrayInputStream(body == null ? new byte[0] : body), null, url);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot parse page " + url, e);
        } finally {
            pages.release();
        }
    }

    /** Cloudflare 등 봇 차단/에러 페이지 여부 */
    public static boolean isChallengePage(Document doc) {
        String title = doc.title();
        if (title.contains("Just a moment") || title.startsWith("Error")) return true;
        return doc.select("#challenge-form, #cf-challenge-running, div.cf-browser-verification").size() > 0;
    }
}
