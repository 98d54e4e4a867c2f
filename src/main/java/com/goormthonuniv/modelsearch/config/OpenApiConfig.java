package com.goormthonuniv.modelsearch.config;

import com.goormthonuniv.modelsearch.search.Source;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.stream.Collectors;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI modelSearchOpenAPI(SearchProperties properties) {
        String sources = Arrays.stream(Source.values()).map(Source::key).collect(Collectors.joining(", "));
        return new OpenAPI()
                .info(new Info()
                        .title("ModelSearch API")
                        .version("v0.1.0")
                        .description("""
                                3D 모델 통합 검색 (%s).
                                메모리 캐시 TTL %s, DB 캐시 보관 %s, 소스당 최대 %d건.
                                """.formatted(sources,
                                properties.getCache().getMemoryTtl(),
                                properties.getCache().getRetention(),
                                properties.getSearch().getMaxResultsPerSource()).strip()))
                .addTagsItem(new Tag().name("search").description("검색 / 상태 확인"));
    }
}
