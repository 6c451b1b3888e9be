package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.crawler.SourceUrls;
import com.anime.tracker.catalogue.exception.CrawlFailureException;
import com.anime.tracker.catalogue.model.AnimeDetail;
import com.anime.tracker.catalogue.model.AnimeUpdate;
import com.anime.tracker.catalogue.model.CacheKey;
import com.anime.tracker.catalogue.model.CompletedAnime;
import com.anime.tracker.catalogue.model.CrawledAnime;
import com.anime.tracker.catalogue.model.Episode;
import com.anime.tracker.catalogue.model.EpisodeSourcesView;
import com.anime.tracker.catalogue.model.ListingQuery;
import com.anime.tracker.catalogue.model.VideoSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Read side used by the REST layer: refreshes a key through the coordinator when it
 * is stale, then reads the store. When a refresh fails and stored rows exist they are
 * served stale if {@code app.cache.serve-stale-on-failure} is on.
 */
@Slf4j
@Service
public class CatalogueQueryService {
    private final FreshnessCoordinator freshnessCoordinator;
    private final CatalogueStore catalogueStore;
    private final SourceUrls sourceUrls;
    private final Duration animeMaxAge;
    private final Duration episodeMaxAge;
    private final Duration feedMaxAge;
    private final Duration listingMaxAge;
    private final boolean serveStaleOnFailure;
    private final int listingPageSize;

    public CatalogueQueryService(FreshnessCoordinator freshnessCoordinator,
                                 CatalogueStore catalogueStore,
                                 SourceUrls sourceUrls,
                                 @Value("${app.cache.max-age.anime-minutes:60}") long animeMaxAgeMinutes,
                                 @Value("${app.cache.max-age.episode-minutes:60}") long episodeMaxAgeMinutes,
                                 @Value("${app.cache.max-age.feed-minutes:60}") long feedMaxAgeMinutes,
                                 @Value("${app.cache.max-age.listing-minutes:30}") long listingMaxAgeMinutes,
                                 @Value("${app.cache.serve-stale-on-failure:true}") boolean serveStaleOnFailure,
                                 @Value("${app.listing.page-size:20}") int listingPageSize) {
        this.freshnessCoordinator = freshnessCoordinator;
        this.catalogueStore = catalogueStore;
        this.sourceUrls = sourceUrls;
        this.animeMaxAge = Duration.ofMinutes(animeMaxAgeMinutes);
        this.episodeMaxAge = Duration.ofMinutes(episodeMaxAgeMinutes);
        this.feedMaxAge = Duration.ofMinutes(feedMaxAgeMinutes);
        this.listingMaxAge = Duration.ofMinutes(listingMaxAgeMinutes);
        this.serveStaleOnFailure = serveStaleOnFailure;
        this.listingPageSize = listingPageSize;
    }

    public Optional<AnimeDetail> getAnime(String slug) {
        refresh(CacheKey.anime(slug), animeMaxAge, () -> catalogueStore.getAnimeBySlug(slug).isPresent());
        return catalogueStore.getAnimeBySlug(slug);
    }

    /**
     * @return empty when the anime itself is unknown
     */
    public Optional<List<Episode>> getEpisodes(String slug) {
        return getAnime(slug).map(anime -> catalogueStore.getEpisodesForAnime(anime.getSlug()));
    }

    public Optional<EpisodeSourcesView> getEpisodeSources(String episodeSlug) {
        String episodeUrl = sourceUrls.episode(episodeSlug);
        refresh(CacheKey.episodeSources(episodeSlug), episodeMaxAge,
                () -> !catalogueStore.getVideoSourcesForEpisode(episodeUrl).isEmpty());
        List<VideoSource> sources = catalogueStore.getVideoSourcesForEpisode(episodeUrl);
        if (sources.isEmpty() && catalogueStore.getEpisodeByUrl(episodeUrl).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new EpisodeSourcesView(episodeSlug, episodeUrl, sources));
    }

    public List<AnimeUpdate> getUpdates() {
        refresh(CacheKey.updates(), feedMaxAge, () -> !catalogueStore.getAnimeUpdates().isEmpty());
        return catalogueStore.getAnimeUpdates();
    }

    public List<CompletedAnime> getCompleted() {
        refresh(CacheKey.completed(), feedMaxAge, () -> !catalogueStore.getCompletedAnime().isEmpty());
        return catalogueStore.getCompletedAnime();
    }

    public List<CrawledAnime> getListing(ListingQuery query) {
        refresh(CacheKey.listing(query), listingMaxAge,
                () -> !catalogueStore.getCrawledAnimePage(query, listingPageSize).isEmpty());
        return catalogueStore.getCrawledAnimePage(query, listingPageSize);
    }

    public boolean invalidate(String renderedKey) {
        return freshnessCoordinator.invalidate(CacheKey.parse(renderedKey));
    }

    private void refresh(CacheKey key, Duration maxAge, BooleanSupplier hasStoredContent) {
        try {
            freshnessCoordinator.ensureFresh(key, maxAge);
        } catch (CrawlFailureException ex) {
            if (serveStaleOnFailure && hasStoredContent.getAsBoolean()) {
                log.warn("Serving stale content for {}: {}", key, ex.getMessage());
                return;
            }
            throw ex;
        }
    }
}
