/* (C)2026 */
package com.ammann.hashbreaker.config;

import com.ammann.hashbreaker.enumeration.JobPriority;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable runtime settings of the hash breaker.
 * <p>
 * Built once at startup by {@link SettingsProducer} from {@code application.properties} and
 * handed to every component by constructor injection. Tests use {@link #builder()} and
 * override only what they need.
 */
public final class HashBreakerSettings {

    private final Path toolPath;
    private final boolean toolForce;
    private final boolean potfileDisable;
    private final Path workDir;
    private final Path quickWordlist;
    private final Path largeWordlist;
    private final Path rulesFile;
    private final Duration jobTtl;
    private final int defaultTimeoutSeconds;
    private final int minTimeoutSeconds;
    private final int maxTimeoutSeconds;
    private final long quickDictionaryEstimate;
    private final long ruleBasedEstimate;
    private final long maskEstimate;
    private final boolean generatorEnabled;
    private final int generatorTotalCandidates;
    private final int generatorBatchSize;
    private final int streamFlushInterval;
    private final int streamChannelCapacity;
    private final Duration cancellationPollInterval;
    private final int dispatcherWorkers;
    private final int maxRetries;
    private final Map<JobPriority, Integer> laneWeights;
    private final Map<JobPriority, Duration> hardTimeLimits;

    private HashBreakerSettings(Builder b) {
        this.toolPath = Objects.requireNonNull(b.toolPath, "toolPath");
        this.toolForce = b.toolForce;
        this.potfileDisable = b.potfileDisable;
        this.workDir = Objects.requireNonNull(b.workDir, "workDir");
        this.quickWordlist = Objects.requireNonNull(b.quickWordlist, "quickWordlist");
        this.largeWordlist = Objects.requireNonNull(b.largeWordlist, "largeWordlist");
        this.rulesFile = Objects.requireNonNull(b.rulesFile, "rulesFile");
        this.jobTtl = Objects.requireNonNull(b.jobTtl, "jobTtl");
        this.defaultTimeoutSeconds = b.defaultTimeoutSeconds;
        this.minTimeoutSeconds = b.minTimeoutSeconds;
        this.maxTimeoutSeconds = b.maxTimeoutSeconds;
        this.quickDictionaryEstimate = b.quickDictionaryEstimate;
        this.ruleBasedEstimate = b.ruleBasedEstimate;
        this.maskEstimate = b.maskEstimate;
        this.generatorEnabled = b.generatorEnabled;
        this.generatorTotalCandidates = b.generatorTotalCandidates;
        this.generatorBatchSize = b.generatorBatchSize;
        this.streamFlushInterval = b.streamFlushInterval;
        this.streamChannelCapacity = b.streamChannelCapacity;
        this.cancellationPollInterval =
                Objects.requireNonNull(b.cancellationPollInterval, "cancellationPollInterval");
        this.dispatcherWorkers = b.dispatcherWorkers;
        this.maxRetries = b.maxRetries;
        this.laneWeights = Collections.unmodifiableMap(new EnumMap<>(b.laneWeights));
        this.hardTimeLimits = Collections.unmodifiableMap(new EnumMap<>(b.hardTimeLimits));

        if (minTimeoutSeconds <= 0 || minTimeoutSeconds > maxTimeoutSeconds) {
            throw new IllegalArgumentException(
                    "Timeout bounds must satisfy 0 < min <= max, got min="
                            + minTimeoutSeconds + " max=" + maxTimeoutSeconds);
        }
        if (defaultTimeoutSeconds < minTimeoutSeconds || defaultTimeoutSeconds > maxTimeoutSeconds) {
            throw new IllegalArgumentException(
                    "Default timeout " + defaultTimeoutSeconds + " outside [" + minTimeoutSeconds
                            + ", " + maxTimeoutSeconds + "]");
        }
        if (generatorBatchSize <= 0 || streamFlushInterval <= 0 || streamChannelCapacity <= 0) {
            throw new IllegalArgumentException("Batch size, flush interval and channel capacity must be positive");
        }
        if (dispatcherWorkers <= 0 || maxRetries < 0) {
            throw new IllegalArgumentException("Dispatcher needs at least one worker and a non-negative retry count");
        }
        for (JobPriority priority : JobPriority.values()) {
            if (!laneWeights.containsKey(priority) || laneWeights.get(priority) <= 0) {
                throw new IllegalArgumentException("Missing or non-positive lane weight for " + priority);
            }
            if (!hardTimeLimits.containsKey(priority)) {
                throw new IllegalArgumentException("Missing hard time limit for " + priority);
            }
            // the lane backstop must never cut into a user budget the API accepts
            if (hardTimeLimits.get(priority).compareTo(Duration.ofSeconds(maxTimeoutSeconds)) <= 0) {
                throw new IllegalArgumentException("Hard time limit " + hardTimeLimits.get(priority)
                        + " of " + priority + " lane must exceed the maximum job timeout of "
                        + maxTimeoutSeconds + "s");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HashBreakerSettings defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.toolPath = toolPath;
        b.toolForce = toolForce;
        b.potfileDisable = potfileDisable;
        b.workDir = workDir;
        b.quickWordlist = quickWordlist;
        b.largeWordlist = largeWordlist;
        b.rulesFile = rulesFile;
        b.jobTtl = jobTtl;
        b.defaultTimeoutSeconds = defaultTimeoutSeconds;
        b.minTimeoutSeconds = minTimeoutSeconds;
        b.maxTimeoutSeconds = maxTimeoutSeconds;
        b.quickDictionaryEstimate = quickDictionaryEstimate;
        b.ruleBasedEstimate = ruleBasedEstimate;
        b.maskEstimate = maskEstimate;
        b.generatorEnabled = generatorEnabled;
        b.generatorTotalCandidates = generatorTotalCandidates;
        b.generatorBatchSize = generatorBatchSize;
        b.streamFlushInterval = streamFlushInterval;
        b.streamChannelCapacity = streamChannelCapacity;
        b.cancellationPollInterval = cancellationPollInterval;
        b.dispatcherWorkers = dispatcherWorkers;
        b.maxRetries = maxRetries;
        b.laneWeights = new EnumMap<>(laneWeights);
        b.hardTimeLimits = new EnumMap<>(hardTimeLimits);
        return b;
    }

    public Path toolPath() {
        return toolPath;
    }

    public boolean toolForce() {
        return toolForce;
    }

    public boolean potfileDisable() {
        return potfileDisable;
    }

    /** Parent directory for per-invocation temp directories. */
    public Path workDir() {
        return workDir;
    }

    public Path quickWordlist() {
        return quickWordlist;
    }

    public Path largeWordlist() {
        return largeWordlist;
    }

    public Path rulesFile() {
        return rulesFile;
    }

    public Duration jobTtl() {
        return jobTtl;
    }

    public int defaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public int minTimeoutSeconds() {
        return minTimeoutSeconds;
    }

    public int maxTimeoutSeconds() {
        return maxTimeoutSeconds;
    }

    public long quickDictionaryEstimate() {
        return quickDictionaryEstimate;
    }

    public long ruleBasedEstimate() {
        return ruleBasedEstimate;
    }

    public long maskEstimate() {
        return maskEstimate;
    }

    public boolean generatorEnabled() {
        return generatorEnabled;
    }

    public int generatorTotalCandidates() {
        return generatorTotalCandidates;
    }

    public int generatorBatchSize() {
        return generatorBatchSize;
    }

    public int streamFlushInterval() {
        return streamFlushInterval;
    }

    public int streamChannelCapacity() {
        return streamChannelCapacity;
    }

    public Duration cancellationPollInterval() {
        return cancellationPollInterval;
    }

    public int dispatcherWorkers() {
        return dispatcherWorkers;
    }

    /** Redeliveries allowed after the first delivery. */
    public int maxRetries() {
        return maxRetries;
    }

    public int laneWeight(JobPriority priority) {
        return laneWeights.get(priority);
    }

    public Duration hardTimeLimit(JobPriority priority) {
        return hardTimeLimits.get(priority);
    }

    public static final class Builder {
        private Path toolPath = Path.of("/usr/bin/hashcat");
        private boolean toolForce = true;
        private boolean potfileDisable = true;
        private Path workDir = Path.of(System.getProperty("java.io.tmpdir"));
        private Path quickWordlist = Path.of("wordlists", "top100k.txt");
        private Path largeWordlist = Path.of("wordlists", "rockyou.txt");
        private Path rulesFile = Path.of("data", "rules", "best64.rule");
        private Duration jobTtl = Duration.ofHours(24);
        private int defaultTimeoutSeconds = 60;
        private int minTimeoutSeconds = 10;
        private int maxTimeoutSeconds = 3600;
        private long quickDictionaryEstimate = 100_000L;
        private long ruleBasedEstimate = 5_000_000L;
        private long maskEstimate = 10_000_000L;
        private boolean generatorEnabled = true;
        private int generatorTotalCandidates = 5_000_000;
        private int generatorBatchSize = 10_000;
        private int streamFlushInterval = 1000;
        private int streamChannelCapacity = 1000;
        private Duration cancellationPollInterval = Duration.ofMillis(500);
        private int dispatcherWorkers = 4;
        private int maxRetries = 3;
        private Map<JobPriority, Integer> laneWeights = new EnumMap<>(Map.of(
                JobPriority.HIGH, 6, JobPriority.NORMAL, 3, JobPriority.LOW, 1));
        private Map<JobPriority, Duration> hardTimeLimits = new EnumMap<>(Map.of(
                JobPriority.HIGH, Duration.ofMinutes(65),
                JobPriority.NORMAL, Duration.ofMinutes(65),
                JobPriority.LOW, Duration.ofMinutes(65)));

        private Builder() {}

        public Builder toolPath(Path toolPath) {
            this.toolPath = toolPath;
            return this;
        }

        public Builder toolForce(boolean toolForce) {
            this.toolForce = toolForce;
            return this;
        }

        public Builder potfileDisable(boolean potfileDisable) {
            this.potfileDisable = potfileDisable;
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder quickWordlist(Path quickWordlist) {
            this.quickWordlist = quickWordlist;
            return this;
        }

        public Builder largeWordlist(Path largeWordlist) {
            this.largeWordlist = largeWordlist;
            return this;
        }

        public Builder rulesFile(Path rulesFile) {
            this.rulesFile = rulesFile;
            return this;
        }

        public Builder jobTtl(Duration jobTtl) {
            this.jobTtl = jobTtl;
            return this;
        }

        public Builder defaultTimeoutSeconds(int defaultTimeoutSeconds) {
            this.defaultTimeoutSeconds = defaultTimeoutSeconds;
            return this;
        }

        public Builder minTimeoutSeconds(int minTimeoutSeconds) {
            this.minTimeoutSeconds = minTimeoutSeconds;
            return this;
        }

        public Builder maxTimeoutSeconds(int maxTimeoutSeconds) {
            this.maxTimeoutSeconds = maxTimeoutSeconds;
            return this;
        }

        public Builder quickDictionaryEstimate(long quickDictionaryEstimate) {
            this.quickDictionaryEstimate = quickDictionaryEstimate;
            return this;
        }

        public Builder ruleBasedEstimate(long ruleBasedEstimate) {
            this.ruleBasedEstimate = ruleBasedEstimate;
            return this;
        }

        public Builder maskEstimate(long maskEstimate) {
            this.maskEstimate = maskEstimate;
            return this;
        }

        public Builder generatorEnabled(boolean generatorEnabled) {
            this.generatorEnabled = generatorEnabled;
            return this;
        }

        public Builder generatorTotalCandidates(int generatorTotalCandidates) {
            this.generatorTotalCandidates = generatorTotalCandidates;
            return this;
        }

        public Builder generatorBatchSize(int generatorBatchSize) {
            this.generatorBatchSize = generatorBatchSize;
            return this;
        }

        public Builder streamFlushInterval(int streamFlushInterval) {
            this.streamFlushInterval = streamFlushInterval;
            return this;
        }

        public Builder streamChannelCapacity(int streamChannelCapacity) {
            this.streamChannelCapacity = streamChannelCapacity;
            return this;
        }

        public Builder cancellationPollInterval(Duration cancellationPollInterval) {
            this.cancellationPollInterval = cancellationPollInterval;
            return this;
        }

        public Builder dispatcherWorkers(int dispatcherWorkers) {
            this.dispatcherWorkers = dispatcherWorkers;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder laneWeight(JobPriority priority, int weight) {
            this.laneWeights.put(priority, weight);
            return this;
        }

        public Builder hardTimeLimit(JobPriority priority, Duration limit) {
            this.hardTimeLimits.put(priority, limit);
            return this;
        }

        public HashBreakerSettings build() {
            return new HashBreakerSettings(this);
        }
    }
}
