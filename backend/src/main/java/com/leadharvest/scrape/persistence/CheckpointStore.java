package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.Checkpoint;

import java.util.Optional;

public interface CheckpointStore {

    /** Overwrites the single checkpoint kept for {@code jobId}. */
    void save(String jobId, Checkpoint checkpoint);

    Optional<Checkpoint> load(String jobId);
}
