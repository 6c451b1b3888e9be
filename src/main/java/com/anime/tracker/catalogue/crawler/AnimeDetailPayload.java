package com.anime.tracker.catalogue.crawler;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record AnimeDetailPayload(
        String slug,
        String url,
        String title,
        String alternateTitles,
        String poster,
        String rating,
        String trailerUrl,
        String status,
        String studio,
        String releaseDate,
        String duration,
        String season,
        String animeType,
        String totalEpisodes,
        String director,
        List<String> casts,
        List<String> genres,
        String synopsis,
        List<EpisodePayload> episodes
) {
    public AnimeDetailPayload {
        casts = casts == null ? List.of() : List.copyOf(casts);
        genres = genres == null ? List.of() : List.copyOf(genres);
        episodes = episodes == null ? List.of() : List.copyOf(episodes);
    }
}
