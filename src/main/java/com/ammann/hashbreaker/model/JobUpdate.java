/* (C)2026 */
package com.ammann.hashbreaker.model;

import com.ammann.hashbreaker.enumeration.JobStatus;
import java.time.Instant;

/**
 * Partial update of a {@link CrackJob}. A {@code null} component means "leave unchanged".
 */
public record JobUpdate(
        JobStatus status,
        Instant startedAt,
        Instant completedAt,
        Integer progress,
        String currentPhase,
        Integer phaseNumber,
        Double timeElapsed,
        Integer timeRemaining,
        String result,
        Integer crackedInPhase,
        Long attempts,
        String reason,
        Integer lastPhase) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private JobStatus status;
        private Instant startedAt;
        private Instant completedAt;
        private Integer progress;
        private String currentPhase;
        private Integer phaseNumber;
        private Double timeElapsed;
        private Integer timeRemaining;
        private String result;
        private Integer crackedInPhase;
        private Long attempts;
        private String reason;
        private Integer lastPhase;

        private Builder() {}

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder currentPhase(String currentPhase) {
            this.currentPhase = currentPhase;
            return this;
        }

        public Builder phaseNumber(int phaseNumber) {
            this.phaseNumber = phaseNumber;
            return this;
        }

        public Builder timeElapsed(double timeElapsed) {
            this.timeElapsed = timeElapsed;
            return this;
        }

        public Builder timeRemaining(int timeRemaining) {
            this.timeRemaining = timeRemaining;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder crackedInPhase(int crackedInPhase) {
            this.crackedInPhase = crackedInPhase;
            return this;
        }

        public Builder attempts(long attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder lastPhase(Integer lastPhase) {
            this.lastPhase = lastPhase;
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(status, startedAt, completedAt, progress, currentPhase, phaseNumber,
                    timeElapsed, timeRemaining, result, crackedInPhase, attempts, reason, lastPhase);
        }
    }
}
