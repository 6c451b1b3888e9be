package com.anime.tracker.catalogue.model;

import java.util.Arrays;

/**
 * Tagged catalogue cache key. The rendered form always starts with the namespace
 * prefix, so keys of different namespaces never collide.
 */
public record CacheKey(CacheNamespace namespace, String id) {
    private static final char SEPARATOR = ':';

    public CacheKey {
        if (namespace == null) {
            throw new IllegalArgumentException("Cache key namespace is required");
        }
        if (namespace.identified()) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Cache key " + namespace.prefix() + " requires an identifier");
            }
            id = id.trim();
        } else if (id != null && !id.isBlank()) {
            throw new IllegalArgumentException("Cache key " + namespace.prefix() + " takes no identifier");
        } else {
            id = null;
        }
    }

    public static CacheKey updates() {
        return new CacheKey(CacheNamespace.UPDATES, null);
    }

    public static CacheKey completed() {
        return new CacheKey(CacheNamespace.COMPLETED, null);
    }

    public static CacheKey anime(String slug) {
        return new CacheKey(CacheNamespace.ANIME, slug);
    }

    public static CacheKey episodeSources(String episodeSlug) {
        return new CacheKey(CacheNamespace.EPISODE_SOURCES, episodeSlug);
    }

    public static CacheKey listing(ListingQuery query) {
        return new CacheKey(CacheNamespace.LISTING, query.keyId());
    }

    public static CacheKey parse(String rendered) {
        if (rendered == null || rendered.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be blank");
        }
        int separator = rendered.indexOf(SEPARATOR);
        String prefix = separator < 0 ? rendered : rendered.substring(0, separator);
        String id = separator < 0 ? null : rendered.substring(separator + 1);
        CacheNamespace namespace = Arrays.stream(CacheNamespace.values())
                .filter(candidate -> candidate.prefix().equals(prefix))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cache key namespace: " + prefix));
        return new CacheKey(namespace, id);
    }

    public String render() {
        return id == null ? namespace.prefix() : namespace.prefix() + SEPARATOR + id;
    }

    @Override
    public String toString() {
        return render();
    }
}
