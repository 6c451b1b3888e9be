package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.crawler.SourceUrls;
import com.anime.tracker.catalogue.exception.CrawlFailureException;
import com.anime.tracker.catalogue.model.AnimeDetail;
import com.anime.tracker.catalogue.model.CacheKey;
import com.anime.tracker.catalogue.model.Episode;
import com.anime.tracker.catalogue.model.EpisodeSourcesView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CatalogueQueryServiceTest {
    @Mock
    private FreshnessCoordinator freshnessCoordinator;

    @Mock
    private CatalogueStore catalogueStore;

    private CatalogueQueryService service;

    @BeforeEach
    void setUp() {
        service = newService(true);
    }

    @Test
    void usesTheAnimeMaxAgeForDetailKeys() {
        AnimeDetail naruto = new AnimeDetail("naruto", "https://x3.sokuja.uk/anime/naruto/");
        given(catalogueStore.getAnimeBySlug("naruto")).willReturn(Optional.of(naruto));

        assertThat(service.getAnime("naruto")).contains(naruto);
        verify(freshnessCoordinator).ensureFresh(CacheKey.anime("naruto"), Duration.ofMinutes(60));
    }

    @Test
    void servesStaleRowsWhenTheRefreshFails() {
        AnimeDetail naruto = new AnimeDetail("naruto", "https://x3.sokuja.uk/anime/naruto/");
        given(freshnessCoordinator.ensureFresh(CacheKey.anime("naruto"), Duration.ofMinutes(60)))
                .willThrow(new CrawlFailureException("down", new IOException("down")));
        given(catalogueStore.getAnimeBySlug("naruto")).willReturn(Optional.of(naruto));

        assertThat(service.getAnime("naruto")).contains(naruto);
    }

    @Test
    void propagatesFailureWhenNothingIsStored() {
        given(freshnessCoordinator.ensureFresh(CacheKey.anime("ghost"), Duration.ofMinutes(60)))
                .willThrow(new CrawlFailureException("down", new IOException("down")));
        given(catalogueStore.getAnimeBySlug("ghost")).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.getAnime("ghost")).isInstanceOf(CrawlFailureException.class);
    }

    @Test
    void propagatesFailureWhenStaleServingIsOff() {
        service = newService(false);
        given(freshnessCoordinator.ensureFresh(CacheKey.anime("naruto"), Duration.ofMinutes(60)))
                .willThrow(new CrawlFailureException("down", new IOException("down")));

        assertThatThrownBy(() -> service.getAnime("naruto")).isInstanceOf(CrawlFailureException.class);
    }

    @Test
    void episodeSourcesAreKeyedByTheBuiltEpisodeUrl() {
        String url = "https://x3.sokuja.uk/naruto-episode-1/";
        given(catalogueStore.getVideoSourcesForEpisode(url)).willReturn(List.of());
        given(catalogueStore.getEpisodeByUrl(url)).willReturn(Optional.of(new Episode("naruto", url)));

        Optional<EpisodeSourcesView> view = service.getEpisodeSources("naruto-episode-1");

        assertThat(view).isPresent();
        assertThat(view.get().episodeUrl()).isEqualTo(url);
        assertThat(view.get().sources()).isEmpty();
        verify(freshnessCoordinator).ensureFresh(CacheKey.episodeSources("naruto-episode-1"), Duration.ofMinutes(60));
    }

    @Test
    void invalidateParsesRenderedKeys() {
        given(freshnessCoordinator.invalidate(CacheKey.anime("naruto"))).willReturn(true);

        assertThat(service.invalidate("anime:naruto")).isTrue();
        assertThatThrownBy(() -> service.invalidate("bogus:key")).isInstanceOf(IllegalArgumentException.class);
    }

    private CatalogueQueryService newService(boolean serveStale) {
        return new CatalogueQueryService(freshnessCoordinator, catalogueStore,
                new SourceUrls("https://x3.sokuja.uk/"), 60, 60, 60, 30, serveStale, 20);
    }
}
