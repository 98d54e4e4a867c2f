package com.goormthonuniv.modelsearch.service;

/**
 * 검색어 하나를 처리하는 동안의 단계.
 * UNRESOLVED → CACHE_CHECK → {FRESH_HIT | PARTIAL_REFRESH | FULL_FETCH} → MERGING → PERSISTED → DONE
 */
public enum ResolutionState {
    UNRESOLVED,
    CACHE_CHECK,
    FRESH_HIT,
    PARTIAL_REFRESH,
    FULL_FETCH,
    MERGING,
    PERSISTED,
    DONE
}
