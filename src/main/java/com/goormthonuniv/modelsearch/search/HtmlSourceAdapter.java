package com.goormthonuniv.modelsearch.search;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 검색 결과 페이지를 받아 카드 단위로 추출하는 어댑터의 공통 뼈대.
 * fetch 경계에서 모든 예외를 잡아 빈 목록으로 바꾼다.
 */
@Slf4j
public abstract class HtmlSourceAdapter implements SourceAdapter {

    private final PageFetcher fetcher;
    private final String endpoint;
    private final boolean enabled;
    private final int limit;

    protected HtmlSourceAdapter(PageFetcher fetcher, String endpoint, boolean enabled, int limit) {
        this.fetcher = fetcher;
        this.endpoint = endpoint;
        this.enabled = enabled;
        this.limit = limit;
    }

    /** 검색어 파라미터 이름 (사이트마다 다름) */
    protected abstract String queryParam();

    protected String extraParams() {
        return "";
    }

    protected abstract List<RawListing> extract(Document doc, int limit);

    @Override
    public List<RawListing> fetch(String query) {
        if (!enabled || endpoint == null || endpoint.isBlank()) {
            log.debug("[ModelSearch] adapter={} disabled", source().key());
            return List.of();
        }
        long started = System.nanoTime();
        try {
            String url = searchUrl(query);
            Document doc = fetcher.load(url);
            if (PageFetcher.isChallengePage(doc)) {
                log.warn("[ModelSearch] adapter={} hit challenge/error page title=\"{}\"", source().key(), doc.title());
                return List.of();
            }
            List<RawListing> items = extract(doc, limit);
            List<RawListing> out = items.size() > limit ? items.subList(0, limit) : items;
            log.info("[ModelSearch] adapter={} query=\"{}\" hits={} took={}ms",
                    source().key(), query, out.size(), (System.nanoTime() - started) / 1_000_000);
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ModelSearch] adapter={} interrupted", source().key());
            return List.of();
        } catch (Exception e) {
            log.warn("[ModelSearch] adapter={} error={}", source().key(), e.toString());
            return List.of();
        }
    }

    String searchUrl(String query) {
        return "%s?%s=%s%s".formatted(endpoint, queryParam(),
                URLEncoder.encode(query, StandardCharsets.UTF_8), extraParams());
    }

    // ===== 추출 헬퍼 =====

    protected static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.strip();
        }
        return null;
    }

    /** 절대 URL 우선, base URI 로 못 풀면 원래 속성값 */
    protected static String absAttr(Element e, String attr) {
        if (e == null || !e.hasAttr(attr)) return null;
        return firstNonBlank(e.absUrl(attr), e.attr(attr));
    }

    /** "123", "1.2k" 처럼 통계로 보이는 span 텍스트들 (문서 순서) */
    protected static List<String> statTexts(Element scope) {
        List<String> out = new ArrayList<>();
        if (scope == null) return out;
        for (Element span : scope.select("span")) {
            String t = span.ownText().strip();
            if (RawListing.looksLikeCount(t)) out.add(t);
        }
        return out;
    }

    protected static Integer statAt(List<String> stats, int index) {
        return index < stats.size() ? RawListing.parseCount(stats.get(index)) : null;
    }
}
