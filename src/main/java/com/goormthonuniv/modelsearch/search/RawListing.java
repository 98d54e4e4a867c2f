package com.goormthonuniv.modelsearch.search;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 어댑터가 돌려주는 가공 전 결과. null 필드는 "알 수 없음".
 */
public record RawListing(
        String title,
        String sourceUrl,     // 절대 URL
        String thumbnailUrl,  // 선택
        String author,        // 선택
        Integer likes,        // 선택
        Integer downloads     // 선택
) {

    private static final Pattern COUNT = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([kKmM]?)$");

    /** "1.2k", "3M", "845" 같은 통계 문자열 → 정수. 해석 불가면 null */
    public static Integer parseCount(String text) {
        if (text == null) return null;
        Matcher m = COUNT.matcher(text.strip().replace(",", ""));
        if (!m.matches()) return null;
        double n = Double.parseDouble(m.group(1));
        switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "k" -> n *= 1_000;
            case "m" -> n *= 1_000_000;
            default -> { }
        }
        return n > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) Math.round(n);
    }

    public static boolean looksLikeCount(String text) {
        return text != null && COUNT.matcher(text.strip().replace(",", "")).matches();
    }
}
