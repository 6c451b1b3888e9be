package com.anime.tracker.catalogue.crawler;

public record EpisodePayload(String number, String title, String url, String releaseDate) {
    public String slug() {
        return Slugs.fromUrl(url);
    }
}
