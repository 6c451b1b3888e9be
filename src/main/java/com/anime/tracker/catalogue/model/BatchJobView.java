package com.anime.tracker.catalogue.model;

import java.time.LocalDateTime;

public record BatchJobView(
        String jobName,
        String label,
        boolean running,
        Long executionId,
        String status,
        String exitCode,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        long readCount,
        long writeCount,
        long filterCount,
        long skipCount
) {
}
