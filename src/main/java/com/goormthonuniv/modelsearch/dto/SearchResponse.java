package com.goormthonuniv.modelsearch.dto;

import com.goormthonuniv.modelsearch.model.Listing;

import java.util.List;
import java.util.Map;

public record SearchResponse(
        String query,                 // 정규화된 검색어
        int total,
        List<Listing> results,        // 소스 순서대로 묶인 결과
        Map<String, Integer> sources  // "thingiverse" -> 건수
) {}
