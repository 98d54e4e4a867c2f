package com.goormthonuniv.modelsearch.controller;

import com.goormthonuniv.modelsearch.dto.HealthResponse;
import com.goormthonuniv.modelsearch.exception.GlobalExceptionHandler;
import com.goormthonuniv.modelsearch.exception.InvalidQueryException;
import com.goormthonuniv.modelsearch.model.Listing;
import com.goormthonuniv.modelsearch.model.QueryResult;
import com.goormthonuniv.modelsearch.search.Source;
import com.goormthonuniv.modelsearch.service.AggregationCoordinator;
import com.goormthonuniv.modelsearch.service.Resolution;
import com.goormthonuniv.modelsearch.service.ResolutionState;
import com.goormthonuniv.modelsearch.service.ResponseAssembler;
import com.goormthonuniv.modelsearch.service.SearchHealthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

    @Mock
    private AggregationCoordinator coordinator;

    @Mock
    private SearchHealthService healthService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SearchController controller = new SearchController(coordinator, new ResponseAssembler(), healthService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void search_shouldReturnEnvelopeWithSourceCounts() throws Exception {
        String url = "https://www.printables.com/model/5551-phone-holder";
        Listing listing = new Listing(Listing.idFor(Source.PRINTABLES, url), "Phone Holder", "https://img/1.jpg",
                "alice", Source.PRINTABLES, url, 152, 1500);
        QueryResult result = QueryResult.of("phone holder", List.of(listing), Instant.now());
        when(coordinator.resolve("Phone Holder")).thenReturn(new Resolution(result, ResolutionState.FULL_FETCH, Set.of()));

        mockMvc.perform(get("/api/search").param("q", "Phone Holder"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("phone holder"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.results[0].id").value("printables_" + url))
                .andExpect(jsonPath("$.results[0].source").value("printables"))
                .andExpect(jsonPath("$.results[0].url").value(url))
                .andExpect(jsonPath("$.results[0].thumbnail").value("https://img/1.jpg"))
                .andExpect(jsonPath("$.results[0].downloads").value(1500))
                .andExpect(jsonPath("$.sources.thingiverse").value(0))
                .andExpect(jsonPath("$.sources.printables").value(1))
                .andExpect(jsonPath("$.sources.makerworld").value(0));
    }

    @Test
    void search_shouldRejectMissingQuery() throws Exception {
        mockMvc.perform(get("/api/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_QUERY"));

        verify(coordinator, never()).resolve(anyString());
    }

    @Test
    void search_shouldRejectBlankQuery() throws Exception {
        when(coordinator.resolve("  ")).thenThrow(new InvalidQueryException("Query parameter required"));

        mockMvc.perform(get("/api/search").param("q", "  "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_QUERY"))
                .andExpect(jsonPath("$.message").value("Query parameter required"));
    }

    @Test
    void health_shouldExposeCacheStatsAndFetcherState() throws Exception {
        when(healthService.health()).thenReturn(new HealthResponse(
                "ok", List.of("thingiverse", "printables", "makerworld"), true, 2,
                new HealthResponse.CacheStatsView(3, null)));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.scrapers[1]").value("printables"))
                .andExpect(jsonPath("$.fetcherRunning").value(true))
                .andExpect(jsonPath("$.memoryEntries").value(2))
                .andExpect(jsonPath("$.cacheStats.totalSearches").value(3));
    }
}
