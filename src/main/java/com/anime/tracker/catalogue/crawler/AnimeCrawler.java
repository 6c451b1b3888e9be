package com.anime.tracker.catalogue.crawler;

import com.anime.tracker.catalogue.model.ListingQuery;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Source of raw catalogue payloads. Implementations fetch and parse pages; they never
 * touch storage.
 */
public interface AnimeCrawler {
    /**
     * @return empty when the source has no such anime
     */
    Optional<AnimeDetailPayload> fetchAnimeDetail(String slug) throws IOException;

    /**
     * @return empty when the source has no such episode
     */
    Optional<EpisodeSourcesPayload> fetchEpisodeSources(String episodeSlug) throws IOException;

    List<AnimeUpdatePayload> fetchUpdates() throws IOException;

    List<CompletedAnimePayload> fetchCompleted() throws IOException;

    List<ListingItemPayload> fetchListing(ListingQuery query) throws IOException;
}
