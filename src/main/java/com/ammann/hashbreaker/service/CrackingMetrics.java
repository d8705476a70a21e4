/* (C)2026 */
package com.ammann.hashbreaker.service;

import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.enumeration.JobPriority;
import com.ammann.hashbreaker.enumeration.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation of the cracking pipeline and dispatcher.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code hash_breaker_jobs_total{status}} finished jobs</li>
 *   <li>{@code hash_breaker_guesses_total{phase}} attempts reported by each phase</li>
 *   <li>{@code hash_breaker_job_duration{status}} and {@code hash_breaker_phase_duration{phase}}</li>
 *   <li>{@code hash_breaker_jobs_running} and {@code hash_breaker_queue_depth{priority}} gauges</li>
 * </ul>
 */
@ApplicationScoped
public class CrackingMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger runningJobs = new AtomicInteger();

    @Inject
    public CrackingMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("hash_breaker_jobs_running", runningJobs, AtomicInteger::get)
                .description("Jobs currently inside the cracking pipeline")
                .register(registry);
    }

    public void jobStarted() {
        runningJobs.incrementAndGet();
    }

    public void jobEnded() {
        runningJobs.decrementAndGet();
    }

    public int runningJobs() {
        return runningJobs.get();
    }

    public void jobFinished(JobStatus status, Duration duration) {
        String tag = status.name().toLowerCase(Locale.ROOT);
        Counter.builder("hash_breaker_jobs_total")
                .description("Jobs that reached a terminal state")
                .tag("status", tag)
                .register(registry)
                .increment();
        Timer.builder("hash_breaker_job_duration")
                .description("Wall-clock time from dequeue to terminal state")
                .tag("status", tag)
                .publishPercentileHistogram()
                .register(registry)
                .record(duration);
    }

    public void phaseFinished(CrackingPhase phase, long attempts, Duration duration) {
        if (attempts > 0) {
            Counter.builder("hash_breaker_guesses_total")
                    .description("Candidate guesses reported per phase (partly estimated)")
                    .tag("phase", phase.method())
                    .register(registry)
                    .increment(attempts);
        }
        Timer.builder("hash_breaker_phase_duration")
                .description("Wall-clock time spent per phase")
                .tag("phase", phase.method())
                .publishPercentileHistogram()
                .register(registry)
                .record(duration);
    }

    public void registerQueueDepth(JobPriority priority, Collection<?> lane) {
        Gauge.builder("hash_breaker_queue_depth", lane, Collection::size)
                .description("Deliveries waiting in a dispatcher lane")
                .tag("priority", priority.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }
}
