package com.anime.tracker.catalogue.crawler;

public final class Slugs {
    private Slugs() {
    }

    /**
     * Last path segment of a url, ignoring a trailing slash:
     * {@code https://host/anime/one-piece/} gives {@code one-piece}.
     */
    public static String fromUrl(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int lastSlash = trimmed.lastIndexOf('/');
        return lastSlash < 0 ? trimmed : trimmed.substring(lastSlash + 1);
    }
}
