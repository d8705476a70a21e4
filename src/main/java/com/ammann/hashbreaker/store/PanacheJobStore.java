/* (C)2026 */
package com.ammann.hashbreaker.store;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.exception.JobStoreException;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.CrackJobEntity;
import com.ammann.hashbreaker.model.JobUpdate;
import io.quarkus.arc.properties.UnlessBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * PostgreSQL-backed job store using Hibernate ORM Panache.
 * <p>
 * Default implementation; replaced by {@link InMemoryJobStore} when
 * {@code hash-breaker.store.type=memory} at build time.
 */
@ApplicationScoped
@UnlessBuildProperty(name = "hash-breaker.store.type", stringValue = "memory", enableIfMissing = true)
public class PanacheJobStore implements JobStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobStore.class);

    private final HashBreakerSettings settings;
    private final Clock clock;

    @Inject
    public PanacheJobStore(HashBreakerSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Optional<CrackJob> get(String id) {
        try {
            CrackJobEntity entity = CrackJobEntity.findLive(id, clock.instant());
            return Optional.ofNullable(entity).map(CrackJobEntity::toModel);
        } catch (PersistenceException e) {
            throw new JobStoreException("Failed to read job " + id, e);
        }
    }

    @Override
    @Transactional
    public void set(CrackJob job, Duration ttl) {
        try {
            write(job, ttl);
        } catch (PersistenceException e) {
            throw new JobStoreException("Failed to write job " + job.id(), e);
        }
    }

    @Override
    public void set(CrackJob job) {
        set(job, settings.jobTtl());
    }

    @Override
    @Transactional
    public boolean update(String id, JobUpdate partial) {
        try {
            CrackJobEntity entity = CrackJobEntity.findLive(id, clock.instant());
            if (entity == null) {
                LOG.debugf("Job %s: update skipped, no live record", id);
                return false;
            }
            CrackJob merged = CrackJob.merge(entity.toModel(), partial);
            entity.apply(merged, clock.instant().plus(settings.jobTtl()));
            return true;
        } catch (PersistenceException e) {
            throw new JobStoreException("Failed to update job " + id, e);
        }
    }

    @Override
    @Transactional
    public List<CrackJob> findByStatus(Collection<JobStatus> statuses) {
        try {
            return CrackJobEntity.findLiveByStatus(statuses, clock.instant()).stream()
                    .map(CrackJobEntity::toModel)
                    .toList();
        } catch (PersistenceException e) {
            throw new JobStoreException("Failed to query jobs by status " + statuses, e);
        }
    }

    @Override
    @Transactional
    public long purgeExpired() {
        try {
            return CrackJobEntity.deleteExpired(clock.instant());
        } catch (PersistenceException e) {
            throw new JobStoreException("Failed to purge expired jobs", e);
        }
    }

    @Override
    @Transactional
    public boolean ping() {
        try {
            CrackJobEntity.count();
            return true;
        } catch (PersistenceException e) {
            LOG.warnf("Job store ping failed: %s", e.getMessage());
            return false;
        }
    }

    private void write(CrackJob job, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        CrackJobEntity entity = CrackJobEntity.findById(job.id());
        if (entity == null) {
            entity = new CrackJobEntity();
            entity.apply(job, expiresAt);
            entity.persist();
        } else {
            entity.apply(job, expiresAt);
        }
    }
}
