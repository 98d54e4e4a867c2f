package com.goormthonuniv.modelsearch.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 검색 대상 사이트. 선언 순서가 곧 병합 결과의 소스 그룹 순서다.
 */
public enum Source {
    THINGIVERSE("thingiverse"),
    PRINTABLES("printables"),
    MAKERWORLD("makerworld");

    private final String key;

    Source(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static Source fromKey(String key) {
        if (key == null) throw new IllegalArgumentException("source key is null");
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (Source s : values()) {
            if (s.key.equals(k)) return s;
        }
        throw new IllegalArgumentException("unknown source: " + key);
    }
}
