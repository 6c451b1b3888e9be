package com.anime.tracker.catalogue.crawler;

import lombok.Builder;

@Builder
public record AnimeUpdatePayload(
        String title,
        String episodeUrl,
        String thumbnail,
        String episodeNumber,
        String animeType,
        String seriesTitle,
        String seriesUrl,
        String status,
        String releaseInfo
) {
}
