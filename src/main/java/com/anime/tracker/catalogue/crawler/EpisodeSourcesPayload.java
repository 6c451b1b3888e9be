package com.anime.tracker.catalogue.crawler;

import java.util.List;

public record EpisodeSourcesPayload(
        String episodeSlug,
        String episodeUrl,
        String title,
        String defaultVideo,
        List<VideoSourcePayload> sources
) {
    public EpisodeSourcesPayload {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
