package com.anime.tracker.catalogue.model;

public enum FreshnessOutcome {
    /** Ledger entry was within max age; nothing was crawled. */
    HIT,
    /** Content was crawled and merged; ledger updated. */
    REFRESHED,
    /** The crawler reported the target does not exist; ledger untouched. */
    NOT_FOUND
}
