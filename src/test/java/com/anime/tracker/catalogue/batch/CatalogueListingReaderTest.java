package com.anime.tracker.catalogue.batch;

import com.anime.tracker.catalogue.crawler.AnimeCrawler;
import com.anime.tracker.catalogue.crawler.ListingItemPayload;
import com.anime.tracker.catalogue.model.ListingQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CatalogueListingReaderTest {
    @Mock
    private AnimeCrawler crawler;

    private CatalogueListingReader reader;

    @BeforeEach
    void setUp() {
        reader = new CatalogueListingReader(crawler);
        ReflectionTestUtils.setField(reader, "maxPages", 10);
        ReflectionTestUtils.setField(reader, "stalePageLimit", 2);
        ReflectionTestUtils.setField(reader, "pageDelayMs", 0L);
        ReflectionTestUtils.setField(reader, "typeFilter", "");
        ReflectionTestUtils.setField(reader, "statusFilter", "");
        ReflectionTestUtils.setField(reader, "order", "");
        reader.beforeStep(null);
    }

    @Test
    void readsPagesUntilAnEmptyPage() throws Exception {
        given(crawler.fetchListing(ListingQuery.ofPage(1))).willReturn(List.of(item("naruto"), item("bleach")));
        given(crawler.fetchListing(ListingQuery.ofPage(2))).willReturn(List.of(item("one-piece")));
        given(crawler.fetchListing(ListingQuery.ofPage(3))).willReturn(List.of());

        assertThat(readAll()).containsExactly("naruto", "bleach", "one-piece");
    }

    @Test
    void stopsAfterConsecutivePagesWithNothingNew() throws Exception {
        given(crawler.fetchListing(any())).willReturn(List.of(item("naruto")));

        assertThat(readAll()).containsExactly("naruto");
        verify(crawler, times(3)).fetchListing(any());
    }

    @Test
    void respectsThePageLimit() throws Exception {
        ReflectionTestUtils.setField(reader, "maxPages", 2);
        given(crawler.fetchListing(ListingQuery.ofPage(1))).willReturn(List.of(item("naruto")));
        given(crawler.fetchListing(ListingQuery.ofPage(2))).willReturn(List.of(item("bleach")));

        assertThat(readAll()).containsExactly("naruto", "bleach");
        verify(crawler, times(2)).fetchListing(any());
    }

    private List<String> readAll() throws Exception {
        List<String> slugs = new ArrayList<>();
        ListingItemPayload item;
        while ((item = reader.read()) != null) {
            slugs.add(item.slug());
        }
        return slugs;
    }

    private static ListingItemPayload item(String slug) {
        return new ListingItemPayload(slug, slug, "https://x3.sokuja.uk/anime/" + slug + "/", "", "", "", "");
    }
}
