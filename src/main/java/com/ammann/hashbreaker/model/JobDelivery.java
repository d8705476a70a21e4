/* (C)2026 */
package com.ammann.hashbreaker.model;

import com.ammann.hashbreaker.enumeration.JobPriority;

/**
 * Message placed on a dispatcher lane.
 *
 * @param attempt zero for the first delivery, incremented on every redelivery
 */
public record JobDelivery(
        String jobId,
        String targetHash,
        int hashTypeId,
        int timeoutSeconds,
        JobPriority priority,
        int attempt) {

    public static JobDelivery first(CrackJob job) {
        return new JobDelivery(job.id(), job.targetHash(), job.hashTypeId(), job.timeoutSeconds(), job.priority(), 0);
    }

    public JobDelivery redelivered() {
        return new JobDelivery(jobId, targetHash, hashTypeId, timeoutSeconds, priority, attempt + 1);
    }
}
