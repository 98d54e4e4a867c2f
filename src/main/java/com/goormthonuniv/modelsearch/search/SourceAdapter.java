package com.goormthonuniv.modelsearch.search;

import java.util.List;

/**
 * 사이트 하나에 대한 검색 어댑터.
 * 구현체는 예외를 밖으로 던지지 않는다. 실패(타임아웃/차단/파싱 실패)는 빈 목록으로 보고한다.
 */
public interface SourceAdapter {
    Source source();
    List<RawListing> fetch(String query);
}
