package com.cronix.scheduler.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.cronix.scheduler.domain.Job;

/**
 * Authoritative storage for job definitions. Implementations are thread-safe and
 * report failures as {@link com.cronix.scheduler.exception.StoreException}.
 */
public interface JobStore {
    Job insert(Job job);

    Optional<Job> findById(String id);

    /**
     * Jobs owned by {@code ownerId}, newest first.
     */
    List<Job> listByOwner(String ownerId, int limit, int offset);

    List<Job> listActive();

    /**
     * Replaces the stored definition except {@code nextFireAt}, which only
     * {@link #updateNextFire} writes. Empty if the job no longer exists.
     */
    Optional<Job> update(Job job);

    boolean delete(String id);

    /**
     * Records the scheduler's next fire time without touching {@code updatedAt}.
     */
    void updateNextFire(String id, Instant nextFireAt);

    /**
     * Cheap round trip used by the health check.
     */
    boolean ping();
}
