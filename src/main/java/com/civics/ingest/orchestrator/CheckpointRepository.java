package com.civics.ingest.orchestrator;

import com.civics.ingest.core.model.Provider;

import java.util.Optional;

/**
 * Storage for provider checkpoints between runs.
 */
public interface CheckpointRepository {

    Optional<ProviderCheckpoint> find(Provider provider);

    void save(ProviderCheckpoint checkpoint);

    void clear(Provider provider);
}
