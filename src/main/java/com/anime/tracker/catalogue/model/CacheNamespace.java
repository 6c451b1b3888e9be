package com.anime.tracker.catalogue.model;

public enum CacheNamespace {
    UPDATES("updates", false),
    COMPLETED("completed", false),
    LISTING("list", true),
    ANIME("anime", true),
    EPISODE_SOURCES("episode", true);

    private final String prefix;
    private final boolean identified;

    CacheNamespace(String prefix, boolean identified) {
        this.prefix = prefix;
        this.identified = identified;
    }

    public String prefix() {
        return prefix;
    }

    public boolean identified() {
        return identified;
    }
}
