package com.anime.tracker.catalogue.api;

import com.anime.tracker.catalogue.exception.CrawlTimeoutException;
import com.anime.tracker.catalogue.model.AnimeDetail;
import com.anime.tracker.catalogue.model.CrawledAnime;
import com.anime.tracker.catalogue.model.ListingQuery;
import com.anime.tracker.catalogue.service.CatalogueQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnimeController.class)
class AnimeControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogueQueryService catalogueQueryService;

    @Test
    void returnsStoredAnime() throws Exception {
        AnimeDetail naruto = new AnimeDetail("naruto", "https://x3.sokuja.uk/anime/naruto/");
        naruto.setTitle("Naruto");
        naruto.setGenres(List.of("Action"));
        given(catalogueQueryService.getAnime("naruto")).willReturn(Optional.of(naruto));

        mockMvc.perform(get("/api/anime/naruto"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value("naruto"))
                .andExpect(jsonPath("$.title").value("Naruto"))
                .andExpect(jsonPath("$.genres[0]").value("Action"))
                .andExpect(jsonPath("$.id").doesNotExist());
    }

    @Test
    void unknownAnimeIs404() throws Exception {
        given(catalogueQueryService.getAnime("ghost")).willReturn(Optional.empty());

        mockMvc.perform(get("/api/anime/ghost")).andExpect(status().isNotFound());
    }

    @Test
    void crawlTimeoutIs504() throws Exception {
        given(catalogueQueryService.getAnime("slow"))
                .willThrow(new CrawlTimeoutException("anime:slow", Duration.ofSeconds(60)));

        mockMvc.perform(get("/api/anime/slow"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void listingPassesFiltersThrough() throws Exception {
        CrawledAnime bleach = new CrawledAnime();
        bleach.setSlug("bleach");
        bleach.setTitle("Bleach");
        given(catalogueQueryService.getListing(new ListingQuery(2, "TV", "Completed", "")))
                .willReturn(List.of(bleach));

        mockMvc.perform(get("/api/anime-list").param("page", "2").param("type", "TV").param("status", "Completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].slug").value("bleach"));
    }

    @Test
    void invalidPageIs400() throws Exception {
        mockMvc.perform(get("/api/anime-list").param("page", "0")).andExpect(status().isBadRequest());
    }

    @Test
    void cacheInvalidation() throws Exception {
        given(catalogueQueryService.invalidate("anime:naruto")).willReturn(true);
        given(catalogueQueryService.invalidate("anime:ghost")).willReturn(false);

        mockMvc.perform(delete("/api/cache/anime:naruto")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/cache/anime:ghost")).andExpect(status().isNotFound());
    }
}
