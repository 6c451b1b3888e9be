package com.anime.tracker.catalogue.model;

public record HistorySnapshot(
        String episodeSlug,
        String animeSlug,
        String episodeTitle,
        String animeTitle,
        String thumbnail
) {
}
