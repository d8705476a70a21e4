/* (C)2026 */
package com.ammann.hashbreaker.store;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobUpdate;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local job store for single-node deployments and tests.
 * <p>
 * Each update runs as one atomic map operation, so it is free of the lost-update window of
 * the database store, but records do not survive a restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "hash-breaker.store.type", stringValue = "memory")
public class InMemoryJobStore implements JobStore {

    private record Entry(CrackJob job, Instant expiresAt) {}

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final HashBreakerSettings settings;
    private final Clock clock;

    @Inject
    public InMemoryJobStore(HashBreakerSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public Optional<CrackJob> get(String id) {
        Entry entry = entries.get(id);
        if (entry == null || isExpired(entry, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.job());
    }

    @Override
    public void set(CrackJob job, Duration ttl) {
        entries.put(job.id(), new Entry(job, clock.instant().plus(ttl)));
    }

    @Override
    public void set(CrackJob job) {
        set(job, settings.jobTtl());
    }

    @Override
    public boolean update(String id, JobUpdate partial) {
        AtomicBoolean updated = new AtomicBoolean(false);
        entries.computeIfPresent(id, (key, entry) -> {
            Instant now = clock.instant();
            if (isExpired(entry, now)) {
                return null;
            }
            updated.set(true);
            return new Entry(CrackJob.merge(entry.job(), partial), now.plus(settings.jobTtl()));
        });
        return updated.get();
    }

    @Override
    public List<CrackJob> findByStatus(Collection<JobStatus> statuses) {
        Instant now = clock.instant();
        return entries.values().stream()
                .filter(entry -> !isExpired(entry, now))
                .map(Entry::job)
                .filter(job -> statuses.contains(job.status()))
                .sorted(Comparator.comparing(CrackJob::submittedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public long purgeExpired() {
        Instant now = clock.instant();
        long removed = 0;
        for (var mapping : entries.entrySet()) {
            if (isExpired(mapping.getValue(), now) && entries.remove(mapping.getKey(), mapping.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private static boolean isExpired(Entry entry, Instant now) {
        return !entry.expiresAt().isAfter(now);
    }
}
