package com.anime.tracker.catalogue.model;

public record AnimeSnapshot(String animeSlug, String animeTitle, String thumbnail) {
}
