package dev.shortlist.job;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime job registry. Entries are never evicted.
 */
@Component
public class InMemoryJobStore implements JobStore {

    private final Map<UUID, TrackedJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(TrackedJob job) {
        jobs.put(job.getId(), job);
    }

    @Override
    public Optional<TrackedJob> find(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Collection<TrackedJob> all() {
        return List.copyOf(jobs.values());
    }
}
