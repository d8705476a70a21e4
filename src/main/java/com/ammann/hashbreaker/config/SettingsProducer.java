/* (C)2026 */
package com.ammann.hashbreaker.config;

import com.ammann.hashbreaker.enumeration.JobPriority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer that assembles {@link HashBreakerSettings} from MicroProfile Config and exposes
 * the system {@link Clock}.
 */
@ApplicationScoped
public class SettingsProducer {

    private static final Logger LOG = Logger.getLogger(SettingsProducer.class);

    @ConfigProperty(name = "hash-breaker.tool.path", defaultValue = "/usr/bin/hashcat")
    String toolPath;

    @ConfigProperty(name = "hash-breaker.tool.force", defaultValue = "true")
    boolean toolForce;

    @ConfigProperty(name = "hash-breaker.tool.potfile-disable", defaultValue = "true")
    boolean potfileDisable;

    @ConfigProperty(name = "hash-breaker.tool.work-dir", defaultValue = "/tmp")
    String workDir;

    @ConfigProperty(name = "hash-breaker.wordlists.dir", defaultValue = "./wordlists")
    String wordlistsDir;

    @ConfigProperty(name = "hash-breaker.wordlists.quick", defaultValue = "top100k.txt")
    String quickWordlist;

    @ConfigProperty(name = "hash-breaker.wordlists.large", defaultValue = "rockyou.txt")
    String largeWordlist;

    @ConfigProperty(name = "hash-breaker.rules.dir", defaultValue = "./data/rules")
    String rulesDir;

    @ConfigProperty(name = "hash-breaker.rules.file", defaultValue = "best64.rule")
    String rulesFile;

    @ConfigProperty(name = "hash-breaker.store.ttl", defaultValue = "PT24H")
    Duration jobTtl;

    @ConfigProperty(name = "hash-breaker.job.default-timeout", defaultValue = "60")
    int defaultTimeout;

    @ConfigProperty(name = "hash-breaker.job.min-timeout", defaultValue = "10")
    int minTimeout;

    @ConfigProperty(name = "hash-breaker.job.max-timeout", defaultValue = "3600")
    int maxTimeout;

    @ConfigProperty(name = "hash-breaker.estimates.quick-dictionary", defaultValue = "100000")
    long quickDictionaryEstimate;

    @ConfigProperty(name = "hash-breaker.estimates.rule-based", defaultValue = "5000000")
    long ruleBasedEstimate;

    @ConfigProperty(name = "hash-breaker.estimates.mask", defaultValue = "10000000")
    long maskEstimate;

    @ConfigProperty(name = "hash-breaker.generator.enabled", defaultValue = "true")
    boolean generatorEnabled;

    @ConfigProperty(name = "hash-breaker.generator.total-candidates", defaultValue = "5000000")
    int generatorTotal;

    @ConfigProperty(name = "hash-breaker.generator.batch-size", defaultValue = "10000")
    int generatorBatchSize;

    @ConfigProperty(name = "hash-breaker.stream.flush-interval", defaultValue = "1000")
    int flushInterval;

    @ConfigProperty(name = "hash-breaker.stream.channel-capacity", defaultValue = "1000")
    int channelCapacity;

    @ConfigProperty(name = "hash-breaker.stream.cancellation-poll-interval", defaultValue = "PT0.5S")
    Duration cancellationPollInterval;

    @ConfigProperty(name = "hash-breaker.dispatcher.workers", defaultValue = "4")
    int workers;

    @ConfigProperty(name = "hash-breaker.dispatcher.max-retries", defaultValue = "3")
    int maxRetries;

    @ConfigProperty(name = "hash-breaker.dispatcher.lane-weights.high", defaultValue = "6")
    int highWeight;

    @ConfigProperty(name = "hash-breaker.dispatcher.lane-weights.normal", defaultValue = "3")
    int normalWeight;

    @ConfigProperty(name = "hash-breaker.dispatcher.lane-weights.low", defaultValue = "1")
    int lowWeight;

    @ConfigProperty(name = "hash-breaker.dispatcher.hard-time-limit.high", defaultValue = "PT65M")
    Duration highLimit;

    @ConfigProperty(name = "hash-breaker.dispatcher.hard-time-limit.normal", defaultValue = "PT65M")
    Duration normalLimit;

    @ConfigProperty(name = "hash-breaker.dispatcher.hard-time-limit.low", defaultValue = "PT65M")
    Duration lowLimit;

    @Produces
    @Singleton
    public HashBreakerSettings settings() {
        HashBreakerSettings settings = HashBreakerSettings.builder()
                .toolPath(Path.of(toolPath))
                .toolForce(toolForce)
                .potfileDisable(potfileDisable)
                .workDir(Path.of(workDir))
                .quickWordlist(Path.of(wordlistsDir, quickWordlist))
                .largeWordlist(Path.of(wordlistsDir, largeWordlist))
                .rulesFile(Path.of(rulesDir, rulesFile))
                .jobTtl(jobTtl)
                .defaultTimeoutSeconds(defaultTimeout)
                .minTimeoutSeconds(minTimeout)
                .maxTimeoutSeconds(maxTimeout)
                .quickDictionaryEstimate(quickDictionaryEstimate)
                .ruleBasedEstimate(ruleBasedEstimate)
                .maskEstimate(maskEstimate)
                .generatorEnabled(generatorEnabled)
                .generatorTotalCandidates(generatorTotal)
                .generatorBatchSize(generatorBatchSize)
                .streamFlushInterval(flushInterval)
                .streamChannelCapacity(channelCapacity)
                .cancellationPollInterval(cancellationPollInterval)
                .dispatcherWorkers(workers)
                .maxRetries(maxRetries)
                .laneWeight(JobPriority.HIGH, highWeight)
                .laneWeight(JobPriority.NORMAL, normalWeight)
                .laneWeight(JobPriority.LOW, lowWeight)
                .hardTimeLimit(JobPriority.HIGH, highLimit)
                .hardTimeLimit(JobPriority.NORMAL, normalLimit)
                .hardTimeLimit(JobPriority.LOW, lowLimit)
                .build();

        LOG.infof("Hash breaker settings: tool=%s, workers=%d, timeout=[%d..%d] default %d, ttl=%s",
                settings.toolPath(), settings.dispatcherWorkers(), settings.minTimeoutSeconds(),
                settings.maxTimeoutSeconds(), settings.defaultTimeoutSeconds(), settings.jobTtl());
        return settings;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
