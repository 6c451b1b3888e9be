package com.anime.tracker.catalogue.crawler;

public record VideoSourcePayload(String server, String quality, String url) {
}
