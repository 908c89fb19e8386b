package com.leadharvest.scrape.model;

import java.time.Instant;

/**
 * Durable resume position. {@code currentPage} is the last page of the area at
 * {@code currentAreaIndex} whose leads were committed; 0 means none yet.
 */
public record Checkpoint(
    String jobId,
    int currentAreaIndex,
    int currentPage,
    int leadsFound,
    int areasCompleted,
    Instant updatedAt
) {
    public static Checkpoint initial(String jobId) {
        return new Checkpoint(jobId, 0, 0, 0, 0, Instant.now());
    }

    public Checkpoint atPage(int page, int leads) {
        return new Checkpoint(jobId, currentAreaIndex, page, leads, areasCompleted, Instant.now());
    }

    public Checkpoint nextArea(int leads) {
        return new Checkpoint(jobId, currentAreaIndex + 1, 0, leads, areasCompleted + 1, Instant.now());
    }

    public Checkpoint restartArea() {
        return new Checkpoint(jobId, currentAreaIndex, 0, leadsFound, areasCompleted, Instant.now());
    }
}
