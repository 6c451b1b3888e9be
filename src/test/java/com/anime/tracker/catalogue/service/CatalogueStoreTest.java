package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.MutableClock;
import com.anime.tracker.catalogue.TestClockConfiguration;
import com.anime.tracker.catalogue.crawler.AnimeDetailPayload;
import com.anime.tracker.catalogue.crawler.EpisodePayload;
import com.anime.tracker.catalogue.crawler.ListingItemPayload;
import com.anime.tracker.catalogue.crawler.VideoSourcePayload;
import com.anime.tracker.catalogue.exception.DuplicateKeyConflictException;
import com.anime.tracker.catalogue.exception.ForeignKeyViolationException;
import com.anime.tracker.catalogue.model.AnimeDetail;
import com.anime.tracker.catalogue.model.CrawledAnime;
import com.anime.tracker.catalogue.model.Episode;
import com.anime.tracker.catalogue.model.ListingQuery;
import com.anime.tracker.catalogue.model.VideoSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
@Import(TestClockConfiguration.class)
class CatalogueStoreTest {
    @Autowired
    private CatalogueStore catalogueStore;

    @Autowired
    private VideoSourceReconciler videoSourceReconciler;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(TestClockConfiguration.START);
    }

    @Test
    void upsertOverwritesMutableFieldsAndKeepsIdentity() {
        AnimeDetail first = catalogueStore.upsertAnime(anime("naruto", "Naruto"));
        clock.advance(Duration.ofMinutes(5));

        AnimeDetail second = catalogueStore.upsertAnime(anime("naruto", "Naruto Shippuden").toBuilder()
                .url("https://x3.sokuja.uk/anime/other/")
                .genres(List.of("Action"))
                .build());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getTitle()).isEqualTo("Naruto Shippuden");
        assertThat(second.getUrl()).isEqualTo("https://x3.sokuja.uk/anime/naruto/");
        assertThat(second.getGenres()).containsExactly("Action");
        assertThat(second.getCreatedAt()).isEqualTo(TestClockConfiguration.START);
        assertThat(second.getUpdatedAt()).isEqualTo(TestClockConfiguration.START.plus(Duration.ofMinutes(5)));
    }

    @Test
    void animeUrlOwnedByAnotherSlugIsAConflict() {
        catalogueStore.upsertAnime(anime("naruto", "Naruto"));

        assertThatThrownBy(() -> catalogueStore.upsertAnime(anime("boruto", "Boruto").toBuilder()
                .url("https://x3.sokuja.uk/anime/naruto/")
                .build()))
                .isInstanceOf(DuplicateKeyConflictException.class);
        assertThat(catalogueStore.getAnimeBySlug("boruto")).isEmpty();
    }

    @Test
    void episodeForUnknownAnimeIsAForeignKeyViolation() {
        assertThatThrownBy(() -> catalogueStore.upsertEpisode("ghost-slug", episode("ghost-slug", 1)))
                .isInstanceOf(ForeignKeyViolationException.class)
                .hasMessageContaining("ghost-slug");
    }

    @Test
    void episodeUrlUnderAnotherAnimeIsAConflict() {
        catalogueStore.upsertAnime(anime("naruto", "Naruto"));
        catalogueStore.upsertAnime(anime("boruto", "Boruto"));
        catalogueStore.upsertEpisode("naruto", episode("naruto", 1));

        assertThatThrownBy(() -> catalogueStore.upsertEpisode("boruto", episode("naruto", 1)))
                .isInstanceOf(DuplicateKeyConflictException.class);
        assertThat(catalogueStore.getEpisodesForAnime("naruto")).hasSize(1);
        assertThat(catalogueStore.getEpisodesForAnime("boruto")).isEmpty();
    }

    @Test
    void reUpsertingAnEpisodeUpdatesTheSameRow() {
        catalogueStore.upsertAnime(anime("naruto", "Naruto"));
        Episode first = catalogueStore.upsertEpisode("naruto", episode("naruto", 1));

        Episode second = catalogueStore.upsertEpisode("naruto",
                new EpisodePayload("1", "Enter: Naruto Uzumaki!", first.getUrl(), "2002-10-03"));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(catalogueStore.getEpisodesForAnime("naruto"))
                .extracting(Episode::getTitle)
                .containsExactly("Enter: Naruto Uzumaki!");
    }

    @Test
    void deletingAnAnimeRemovesOnlyItsOwnEpisodes() {
        catalogueStore.upsertAnime(anime("naruto", "Naruto"));
        catalogueStore.upsertAnime(anime("bleach", "Bleach"));
        catalogueStore.upsertEpisode("naruto", episode("naruto", 1));
        catalogueStore.upsertEpisode("naruto", episode("naruto", 2));
        catalogueStore.upsertEpisode("bleach", episode("bleach", 1));

        assertThat(catalogueStore.deleteAnime("naruto")).isTrue();

        assertThat(catalogueStore.getAnimeBySlug("naruto")).isEmpty();
        assertThat(catalogueStore.getEpisodesForAnime("naruto")).isEmpty();
        assertThat(catalogueStore.getEpisodesForAnime("bleach")).hasSize(1);
        assertThat(catalogueStore.deleteAnime("naruto")).isFalse();
    }

    @Test
    void videoSourcesSurviveEpisodeDeletionUntilReconciled() {
        catalogueStore.upsertAnime(anime("naruto", "Naruto"));
        catalogueStore.upsertAnime(anime("bleach", "Bleach"));
        Episode naruto = catalogueStore.upsertEpisode("naruto", episode("naruto", 1));
        Episode bleach = catalogueStore.upsertEpisode("bleach", episode("bleach", 1));
        catalogueStore.upsertVideoSource(naruto.getUrl(), new VideoSourcePayload("SOKUJA", "720p", "https://cdn/n720"));
        catalogueStore.upsertVideoSource(bleach.getUrl(), new VideoSourcePayload("SOKUJA", "720p", "https://cdn/b720"));

        catalogueStore.deleteAnime("naruto");

        assertThat(catalogueStore.getVideoSourcesForEpisode(naruto.getUrl())).hasSize(1);
        assertThat(videoSourceReconciler.collectOrphans()).isEqualTo(1);
        assertThat(catalogueStore.getVideoSourcesForEpisode(naruto.getUrl())).isEmpty();
        assertThat(catalogueStore.getVideoSourcesForEpisode(bleach.getUrl())).hasSize(1);
    }

    @Test
    void mergeVideoSourcesReplacesTheStoredSet() {
        String episodeUrl = "https://x3.sokuja.uk/naruto-episode-1/";
        catalogueStore.mergeVideoSources(episodeUrl, List.of(
                new VideoSourcePayload("SOKUJA", "720p", "https://cdn/old720"),
                new VideoSourcePayload("SOKUJA", "480p", "https://cdn/old480")));

        catalogueStore.mergeVideoSources(episodeUrl, List.of(
                new VideoSourcePayload("SOKUJA", "720p", "https://cdn/new720"),
                new VideoSourcePayload("MEGA", null, "https://cdn/mega"),
                new VideoSourcePayload("MEGA", "", "https://cdn/mega-latest")));

        assertThat(catalogueStore.getVideoSourcesForEpisode(episodeUrl))
                .extracting(VideoSource::getServer, VideoSource::getQuality, VideoSource::getUrl)
                .containsExactlyInAnyOrder(
                        org.assertj.core.groups.Tuple.tuple("SOKUJA", "720p", "https://cdn/new720"),
                        org.assertj.core.groups.Tuple.tuple("MEGA", "", "https://cdn/mega-latest"));
    }

    @Test
    void crawledAnimePageFiltersAndSorts() {
        catalogueStore.upsertCrawledAnime(listing("bleach", "Bleach", "Completed", "TV"));
        catalogueStore.upsertCrawledAnime(listing("naruto", "Naruto", "Completed", "TV"));
        catalogueStore.upsertCrawledAnime(listing("one-piece", "One Piece", "Ongoing", "TV"));
        catalogueStore.upsertCrawledAnime(listing("akira", "Akira", "Completed", "Movie"));

        List<CrawledAnime> completedTv = catalogueStore.getCrawledAnimePage(
                new ListingQuery(1, "tv", "completed", "titlereverse"), 10);
        List<CrawledAnime> secondPage = catalogueStore.getCrawledAnimePage(ListingQuery.ofPage(2), 3);

        assertThat(completedTv).extracting(CrawledAnime::getSlug).containsExactly("naruto", "bleach");
        assertThat(secondPage).extracting(CrawledAnime::getSlug).containsExactly("one-piece");
        assertThat(catalogueStore.countCrawledAnime()).isEqualTo(4);
    }

    private static AnimeDetailPayload anime(String slug, String title) {
        return AnimeDetailPayload.builder()
                .slug(slug)
                .url("https://x3.sokuja.uk/anime/" + slug + "/")
                .title(title)
                .status("Completed")
                .build();
    }

    private static EpisodePayload episode(String slug, int number) {
        return new EpisodePayload(String.valueOf(number), "Episode " + number,
                "https://x3.sokuja.uk/" + slug + "-episode-" + number + "/", "");
    }

    private static ListingItemPayload listing(String slug, String title, String status, String type) {
        return new ListingItemPayload(slug, title, "https://x3.sokuja.uk/anime/" + slug + "/", "", status, type, "");
    }
}
