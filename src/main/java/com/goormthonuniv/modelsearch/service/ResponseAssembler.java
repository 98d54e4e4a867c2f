package com.goormthonuniv.modelsearch.service;

import com.goormthonuniv.modelsearch.dto.SearchResponse;
import com.goormthonuniv.modelsearch.model.QueryResult;
import com.goormthonuniv.modelsearch.search.Source;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ResponseAssembler {

    public SearchResponse assemble(QueryResult result) {
        Map<String, Integer> sources = new LinkedHashMap<>();
        for (Source s : Source.values()) {
            sources.put(s.key(), result.count(s));
        }
        return new SearchResponse(
                result.normalizedQuery(),
                result.listings().size(),
                result.listings(),
                sources
        );
    }
}
