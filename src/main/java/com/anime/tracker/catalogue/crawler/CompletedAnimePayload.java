package com.anime.tracker.catalogue.crawler;

import lombok.Builder;

import java.util.List;

@Builder
public record CompletedAnimePayload(
        String title,
        String url,
        String thumbnail,
        String animeType,
        String episodeCount,
        String status,
        String postedBy,
        String postedAt,
        String seriesTitle,
        String seriesUrl,
        List<String> genres,
        String rating
) {
    public CompletedAnimePayload {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }
}
