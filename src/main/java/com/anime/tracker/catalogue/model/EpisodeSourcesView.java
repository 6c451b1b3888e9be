package com.anime.tracker.catalogue.model;

import java.util.List;

public record EpisodeSourcesView(String episodeSlug, String episodeUrl, List<VideoSource> sources) {
}
