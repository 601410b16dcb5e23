package com.itiac.core.snapshot;

import com.itiac.core.model.InfrastructureSnapshot;

/**
 * Supplies a consistent snapshot of components, dependencies and workflows.
 *
 * <p>Implemented by whatever owns the data (a database, an API client, a file). The analysis
 * never reads anything else.
 */
public interface SnapshotSource {

    /**
     * Reads a snapshot.
     *
     * @return consistent snapshot
     * @throws SnapshotValidationException if the stored data misses required fields
     */
    InfrastructureSnapshot load();
}
