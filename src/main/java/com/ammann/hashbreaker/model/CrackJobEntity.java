/* (C)2026 */
package com.ammann.hashbreaker.model;

import com.ammann.hashbreaker.enumeration.JobPriority;
import com.ammann.hashbreaker.enumeration.JobStatus;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistent form of a {@link CrackJob}.
 * <p>
 * Rows carry an {@code expires_at} timestamp that emulates a key-value TTL: expired rows are
 * invisible to finders and are removed by the scheduled purge.
 */
@Entity
@Table(
        name = "crack_jobs",
        indexes = {
            @Index(name = "idx_crack_jobs_status", columnList = "status"),
            @Index(name = "idx_crack_jobs_expires_at", columnList = "expires_at")
        })
public class CrackJobEntity extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    public String id;

    @Column(name = "record_version", nullable = false)
    public long recordVersion;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(name = "target_hash", columnDefinition = "TEXT")
    public String targetHash;

    @Column(name = "hash_type_id", nullable = false)
    public int hashTypeId;

    @Column(name = "timeout_seconds", nullable = false)
    public int timeoutSeconds;

    @Column(nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    public JobPriority priority;

    @Column(name = "submitted_at")
    public Instant submittedAt;

    @Column(name = "started_at")
    public Instant startedAt;

    @Column(name = "completed_at")
    public Instant completedAt;

    public Integer progress;

    @Column(name = "current_phase", length = 64)
    public String currentPhase;

    @Column(name = "phase_number")
    public Integer phaseNumber;

    @Column(name = "time_elapsed")
    public Double timeElapsed;

    @Column(name = "time_remaining")
    public Integer timeRemaining;

    @Column(columnDefinition = "TEXT")
    public String result;

    @Column(name = "cracked_in_phase")
    public Integer crackedInPhase;

    public Long attempts;

    @Column(columnDefinition = "TEXT")
    public String reason;

    @Column(name = "last_phase")
    public Integer lastPhase;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    /**
     * Copies every field of the record onto this entity and resets its expiry.
     */
    public void apply(CrackJob job, Instant expiresAt) {
        this.id = job.id();
        this.recordVersion = job.version();
        this.status = job.status();
        this.targetHash = job.targetHash();
        this.hashTypeId = job.hashTypeId();
        this.timeoutSeconds = job.timeoutSeconds();
        this.priority = job.priority();
        this.submittedAt = job.submittedAt();
        this.startedAt = job.startedAt();
        this.completedAt = job.completedAt();
        this.progress = job.progress();
        this.currentPhase = job.currentPhase();
        this.phaseNumber = job.phaseNumber();
        this.timeElapsed = job.timeElapsed();
        this.timeRemaining = job.timeRemaining();
        this.result = job.result();
        this.crackedInPhase = job.crackedInPhase();
        this.attempts = job.attempts();
        this.reason = job.reason();
        this.lastPhase = job.lastPhase();
        this.expiresAt = expiresAt;
    }

    public CrackJob toModel() {
        return new CrackJob(id, recordVersion, status, targetHash, hashTypeId, timeoutSeconds,
                priority, submittedAt, startedAt, completedAt, progress, currentPhase, phaseNumber,
                timeElapsed, timeRemaining, result, crackedInPhase, attempts, reason, lastPhase);
    }

    // Finder methods

    /**
     * Find a job that has not expired yet.
     *
     * @param id Job id
     * @param now Reference time for expiry
     * @return Entity or null if absent or expired
     */
    public static CrackJobEntity findLive(String id, Instant now) {
        return find("id = ?1 AND expiresAt > ?2", id, now).firstResult();
    }

    /**
     * Find live jobs in any of the given states, oldest submission first.
     */
    public static List<CrackJobEntity> findLiveByStatus(Collection<JobStatus> statuses, Instant now) {
        return list("status IN ?1 AND expiresAt > ?2 ORDER BY submittedAt", statuses, now);
    }

    /**
     * Delete expired rows.
     *
     * @return Number of rows removed
     */
    public static long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
