/* (C)2026 */
package com.ammann.hashbreaker.store;

import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobUpdate;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Job state storage with per-record expiry.
 * <p>
 * {@link #update(String, JobUpdate)} is a read, merge, write sequence. It is not atomic with
 * respect to other writers: a cancel request racing a phase-boundary update may be reordered.
 * Implementations throw {@link com.ammann.hashbreaker.exception.JobStoreException} when the
 * backing store fails.
 */
public interface JobStore {

    /**
     * @return the live record, or empty when it never existed or has expired
     */
    Optional<CrackJob> get(String id);

    /**
     * Writes the full record and sets its expiry to {@code ttl} from now.
     */
    void set(CrackJob job, Duration ttl);

    /**
     * Writes the full record with the configured default expiry.
     */
    void set(CrackJob job);

    /**
     * Merges {@code partial} into the live record and refreshes its expiry.
     *
     * @return false when there is no live record to update
     */
    boolean update(String id, JobUpdate partial);

    List<CrackJob> findByStatus(Collection<JobStatus> statuses);

    /**
     * Removes expired records.
     *
     * @return number of records removed
     */
    long purgeExpired();

    /**
     * Cheap round trip used by the readiness check.
     */
    boolean ping();
}
