package com.goormthonuniv.modelsearch.search;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HtmlSourceAdapterTest {

    @Mock
    private PageFetcher fetcher;

    private SearchProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SearchProperties();
    }

    @Test
    void thingiverse_shouldExtractCardsWithAbsoluteUrls() throws Exception {
        ThingiverseAdapter adapter = new ThingiverseAdapter(fetcher, properties, "https://www.thingiverse.com/search", true);
        when(fetcher.load(anyString())).thenReturn(fixture("thingiverse-search.html", "https://www.thingiverse.com/search?q=phone"));

        List<RawListing> items = adapter.fetch("phone holder");

        assertEquals(2, items.size());
        RawListing first = items.get(0);
        assertEquals("Phone Holder v2", first.title());
        assertEquals("https://www.thingiverse.com/thing:1001", first.sourceUrl());
        assertEquals("https://cdn.thingiverse.com/1001.jpg", first.thumbnailUrl());
        assertEquals("maker_joe", first.author());
        assertEquals(1200, first.likes());
        assertNull(first.downloads());

        RawListing second = items.get(1);
        assertEquals("https://www.thingiverse.com/thing:1002", second.sourceUrl());
        assertEquals("https://cdn.thingiverse.com/1002.jpg", second.thumbnailUrl());
        assertEquals(87, second.likes());
    }

    @Test
    void printables_shouldSkipAvatarImagesAndReadStats() throws Exception {
        PrintablesAdapter adapter = new PrintablesAdapter(fetcher, properties, "https://www.printables.com/search/models", true);
        when(fetcher.load(anyString())).thenReturn(fixture("printables-search.html", "https://www.printables.com/search/models?q=phone"));

        List<RawListing> items = adapter.fetch("phone holder");

        assertEquals(2, items.size());
        RawListing first = items.get(0);
        assertEquals("Phone Holder Classic", first.title());
        assertEquals("https://www.printables.com/model/5551-phone-holder", first.sourceUrl());
        assertEquals("https://media.printables.com/5551_small.webp", first.thumbnailUrl());
        assertEquals("alice", first.author());
        assertEquals(152, first.likes());
        assertEquals(1500, first.downloads());

        RawListing second = items.get(1);
        assertEquals("Car Mount", second.title());
        assertEquals("https://media.printables.com/5552.jpg", second.thumbnailUrl());
        assertNull(second.author());
        assertNull(second.likes());
    }

    @Test
    void makerWorld_shouldDeduplicateLinksAndIgnoreCategoryPages() throws Exception {
        MakerWorldAdapter adapter = new MakerWorldAdapter(fetcher, properties, "https://makerworld.com/en/search/models", true);
        when(fetcher.load(anyString())).thenReturn(fixture("makerworld-search.html", "https://makerworld.com/en/search/models?keyword=phone"));

        List<RawListing> items = adapter.fetch("phone holder");

        assertEquals(2, items.size());
        assertEquals("Phone Holder Pro", items.get(0).title());
        assertEquals("https://makerworld.com/en/models/777001", items.get(0).sourceUrl());
        assertEquals("bambu_fan", items.get(0).author());
        assertEquals(340, items.get(0).likes());
        assertEquals(2100, items.get(0).downloads());
        assertEquals("Tablet Stand", items.get(1).title());
        assertEquals(45, items.get(1).likes());
    }

    @Test
    void fetch_shouldCapResultsPerSource() throws Exception {
        properties.getSearch().setMaxResultsPerSource(1);
        ThingiverseAdapter adapter = new ThingiverseAdapter(fetcher, properties, "https://www.thingiverse.com/search", true);
        when(fetcher.load(anyString())).thenReturn(fixture("thingiverse-search.html", "https://www.thingiverse.com/search?q=phone"));

        assertEquals(1, adapter.fetch("phone").size());
    }

    @Test
    void fetch_shouldReturnEmptyOnChallengePage() throws Exception {
        MakerWorldAdapter adapter = new MakerWorldAdapter(fetcher, properties, "https://makerworld.com/en/search/models", true);
        when(fetcher.load(anyString())).thenReturn(fixture("challenge.html", "https://makerworld.com/en/search/models?keyword=x"));

        assertTrue(adapter.fetch("phone").isEmpty());
    }

    @Test
    void fetch_shouldNeverThrowPastBoundary() throws Exception {
        PrintablesAdapter adapter = new PrintablesAdapter(fetcher, properties, "https://www.printables.com/search/models", true);
        when(fetcher.load(anyString())).thenThrow(new TimeoutException("no free page slot"));

        assertTrue(adapter.fetch("phone").isEmpty());
    }

    @Test
    void fetch_shouldSkipNetworkWhenDisabled() throws Exception {
        ThingiverseAdapter adapter = new ThingiverseAdapter(fetcher, properties, "https://www.thingiverse.com/search", false);

        assertTrue(adapter.fetch("phone").isEmpty());
        verify(fetcher, never()).load(anyString());
    }

    @Test
    void searchUrl_shouldEncodeQueryWithSourceSpecificParams() {
        ThingiverseAdapter thingiverse = new ThingiverseAdapter(fetcher, properties, "https://www.thingiverse.com/search", true);
        MakerWorldAdapter makerWorld = new MakerWorldAdapter(fetcher, properties, "https://makerworld.com/en/search/models", true);

        assertEquals("https://www.thingiverse.com/search?q=phone+holder&type=things", thingiverse.searchUrl("phone holder"));
        assertEquals("https://makerworld.com/en/search/models?keyword=phone+holder", makerWorld.searchUrl("phone holder"));
    }

    private static Document fixture(String name, String baseUri) throws IOException {
        try (InputStream in = HtmlSourceAdapterTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return Jsoup.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), baseUri);
        }
    }
}
