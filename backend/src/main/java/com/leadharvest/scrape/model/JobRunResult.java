package com.leadharvest.scrape.model;

public record JobRunResult(
    String jobId,
    JobStatus status,
    int leadsFound,
    int areasCompleted,
    int pagesFetched,
    int retries,
    String lastError
) {
    public static JobRunResult notClaimed(String jobId, JobStatus current) {
        return new JobRunResult(jobId, current, 0, 0, 0, 0, "not_claimable");
    }
}
