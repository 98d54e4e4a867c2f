package com.goormthonuniv.modelsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.goormthonuniv.modelsearch.search.Source;

public record Listing(
        String id,                                  // "<source>_<url>"
        String title,
        @JsonProperty("thumbnail") String thumbnailUrl,
        String author,
        Source source,
        @JsonProperty("url") String sourceUrl,
        int likes,
        int downloads
) {

    public static String idFor(Source source, String sourceUrl) {
        return source.key() + "_" + sourceUrl;
    }
}
