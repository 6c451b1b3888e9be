package com.anime.tracker.catalogue.model;

public record BatchStartResponse(String jobName, Long executionId, String message) {
}
