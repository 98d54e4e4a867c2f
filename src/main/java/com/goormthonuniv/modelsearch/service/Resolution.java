package com.goormthonuniv.modelsearch.service;

import com.goormthonuniv.modelsearch.model.QueryResult;
import com.goormthonuniv.modelsearch.search.Source;

import java.util.Set;

/**
 * 집계 결과와 어떤 경로(캐시 적중/부분 갱신/전체 조회)로 만들어졌는지.
 * fetchedSources 는 이번에 실제로 어댑터를 호출한 소스들.
 */
public record Resolution(
        QueryResult result,
        ResolutionState path,
        Set<Source> fetchedSources
) {}
