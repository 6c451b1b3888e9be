package com.anime.tracker.catalogue.model;

import java.time.Instant;

public record FreshnessResult(
        CacheKey key,
        FreshnessOutcome outcome,
        Instant lastFetched
) {
    public boolean found() {
        return outcome != FreshnessOutcome.NOT_FOUND;
    }
}
