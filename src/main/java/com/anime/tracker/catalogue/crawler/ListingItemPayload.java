package com.anime.tracker.catalogue.crawler;

public record ListingItemPayload(
        String slug,
        String title,
        String url,
        String thumbnail,
        String status,
        String animeType,
        String episodeStatus
) {
}
