package com.goormthonuniv.modelsearch.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 검색어 → 캐시 키.
 * NFKC 정규화, 앞뒤 공백 제거, 연속 공백을 한 칸으로, Locale.ROOT 소문자. 구두점은 유지한다.
 * 200자를 넘으면 자르되 서로게이트 쌍은 나누지 않는다.
 */
public final class QueryNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final int MAX_LEN = 200;

    private QueryNormalizer() {}

    public static String normalize(String query) {
        if (query == null) return "";
        String q = Normalizer.normalize(query, Normalizer.Form.NFKC);
        q = WHITESPACE.matcher(q).replaceAll(" ").strip();
        q = q.toLowerCase(Locale.ROOT);
        if (q.length() > MAX_LEN) {
            int end = Character.isHighSurrogate(q.charAt(MAX_LEN - 1)) ? MAX_LEN - 1 : MAX_LEN;
            q = q.substring(0, end).strip();
        }
        return q;
    }
}
