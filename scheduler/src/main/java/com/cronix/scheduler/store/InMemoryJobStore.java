package com.cronix.scheduler.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.cronix.scheduler.domain.Job;

/**
 * Job store kept on the heap. Used by tests and by {@code STORE=memory}.
 */
public class InMemoryJobStore implements JobStore {
    private static final Comparator<Job> NEWEST_FIRST = Comparator.comparing(Job::getCreatedAt).reversed()
            .thenComparing(Job::getId);

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    @Override
    public synchronized Job insert(Job job) {
        if (jobs.containsKey(job.getId())) {
            throw new IllegalArgumentException("job " + job.getId() + " already exists");
        }
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public synchronized Optional<Job> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized List<Job> listByOwner(String ownerId, int limit, int offset) {
        return jobs.values().stream()
                .filter(j -> ownerId.equals(j.getOwnerId()))
                .sorted(NEWEST_FIRST)
                .skip(offset)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Job> listActive() {
        List<Job> out = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.isActive()) {
                out.add(job);
            }
        }
        return out;
    }

    @Override
    public synchronized Optional<Job> update(Job job) {
        Job current = jobs.get(job.getId());
        if (current == null) {
            return Optional.empty();
        }
        Job stored = job.toBuilder().nextFireAt(current.getNextFireAt()).build();
        jobs.put(job.getId(), stored);
        return Optional.of(stored);
    }

    @Override
    public synchronized boolean delete(String id) {
        return jobs.remove(id) != null;
    }

    @Override
    public synchronized void updateNextFire(String id, Instant nextFireAt) {
        jobs.computeIfPresent(id, (k, job) -> job.toBuilder().nextFireAt(nextFireAt).build());
    }

    @Override
    public boolean ping() {
        return true;
    }
}
