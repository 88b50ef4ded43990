package com.civics.ingest.orchestrator;

import com.civics.ingest.core.model.Provider;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final Map<Provider, ProviderCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<ProviderCheckpoint> find(Provider provider) {
        return Optional.ofNullable(checkpoints.get(provider));
    }

    @Override
    public void save(ProviderCheckpoint checkpoint) {
        checkpoints.put(checkpoint.provider(), checkpoint);
    }

    @Override
    public void clear(Provider provider) {
        checkpoints.remove(provider);
    }
}
