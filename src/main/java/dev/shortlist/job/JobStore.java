package dev.shortlist.job;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of tracked jobs. Implementations must be safe for concurrent use.
 */
public interface JobStore {

    void save(TrackedJob job);

    Optional<TrackedJob> find(UUID id);

    Collection<TrackedJob> all();
}
