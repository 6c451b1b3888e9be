package com.anime.tracker.catalogue.api;

import java.time.Instant;

public record ApiError(String message, Instant timestamp) {
}
