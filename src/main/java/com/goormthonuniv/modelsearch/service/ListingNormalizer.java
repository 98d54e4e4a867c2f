package com.goormthonuniv.modelsearch.service;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import com.goormthonuniv.modelsearch.model.Listing;
import com.goormthonuniv.modelsearch.search.RawListing;
import com.goormthonuniv.modelsearch.search.Source;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 어댑터 원본 → {@link Listing}.
 * 제목이나 URL 이 없는 항목은 버리고, 같은 URL 은 처음 것만 남긴다. 순서는 어댑터 순서 그대로.
 */
@Service
@RequiredArgsConstructor
public class ListingNormalizer {

    static final String UNKNOWN_AUTHOR = "Unknown";

    private final SearchProperties properties;

    public List<Listing> normalize(Source source, List<RawListing> raw) {
        if (raw == null || raw.isEmpty()) return List.of();
        int limit = properties.getSearch().getMaxResultsPerSource();

        Set<String> seenUrls = new LinkedHashSet<>();
        List<Listing> out = new ArrayList<>();
        for (RawListing r : raw) {
            if (out.size() >= limit) break;
            if (r == null) continue;
            String url = trim(r.sourceUrl());
            String title = trim(r.title());
            if (url.isEmpty() || title.isEmpty() || !seenUrls.add(url)) continue;

            String author = trim(r.author());
            out.add(new Listing(
                    Listing.idFor(source, url),
                    title,
                    trim(r.thumbnailUrl()),
                    author.isEmpty() ? UNKNOWN_AUTHOR : author,
                    source,
                    url,
                    nonNegative(r.likes()),
                    nonNegative(r.downloads())
            ));
        }
        return out;
    }

    private static String trim(String s) {
        return s == null ? "" : s.strip();
    }

    private static int nonNegative(Integer n) {
        return n == null || n < 0 ? 0 : n;
    }
}
