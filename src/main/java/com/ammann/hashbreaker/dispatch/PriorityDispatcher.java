/* (C)2026 */
package com.ammann.hashbreaker.dispatch;

import com.ammann.hashbreaker.config.ExecutorProducer;
import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.JobPriority;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.exception.JobStoreException;
import com.ammann.hashbreaker.model.JobDelivery;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.service.CrackingMetrics;
import com.ammann.hashbreaker.service.CrackingPipeline;
import com.ammann.hashbreaker.store.JobStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/**
 * Three-lane job dispatcher with a fixed pool of workers.
 *
 * <p>Each worker takes one delivery at a time, preferring lanes in proportion to their weights
 * and falling back to any non-empty lane, and runs the pipeline on a separate executor so the
 * lane's hard time limit can be enforced. Delivery semantics:
 * <ul>
 *   <li>an exception escaping the pipeline redelivers the job to the same lane, up to
 *   {@code max-retries} times, restarting from phase 1</li>
 *   <li>a pipeline exceeding the hard time limit is interrupted and the job is marked FAILED
 *   without redelivery</li>
 * </ul>
 */
@ApplicationScoped
public class PriorityDispatcher {

    private static final Logger LOG = Logger.getLogger(PriorityDispatcher.class);

    private static final long POLL_MILLIS = 250;

    private final CrackingPipeline pipeline;
    private final JobStore store;
    private final CrackingMetrics metrics;
    private final HashBreakerSettings settings;
    private final Clock clock;
    private final ExecutorService workerExecutor;
    private final ExecutorService pipelineExecutor;

    private final Map<JobPriority, BlockingQueue<JobDelivery>> lanes = new EnumMap<>(JobPriority.class);
    private final List<JobPriority> schedule;
    private final Semaphore available = new Semaphore(0);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicLong ticket = new AtomicLong();

    @Inject
    public PriorityDispatcher(
            CrackingPipeline pipeline,
            JobStore store,
            CrackingMetrics metrics,
            HashBreakerSettings settings,
            Clock clock,
            @Named(ExecutorProducer.WORKER_EXECUTOR) ExecutorService workerExecutor,
            @Named(ExecutorProducer.PIPELINE_EXECUTOR) ExecutorService pipelineExecutor) {
        this.pipeline = pipeline;
        this.store = store;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
        this.pipelineExecutor = pipelineExecutor;

        List<JobPriority> slots = new ArrayList<>();
        for (JobPriority priority : JobPriority.values()) {
            BlockingQueue<JobDelivery> lane = new LinkedBlockingQueue<>();
            lanes.put(priority, lane);
            metrics.registerQueueDepth(priority, lane);
            for (int i = 0; i < settings.laneWeight(priority); i++) {
                slots.add(priority);
            }
        }
        this.schedule = Collections.unmodifiableList(slots);
    }

    /**
     * Starts the worker loops. Calling it again while running has no effect.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 1; i <= settings.dispatcherWorkers(); i++) {
            int workerId = i;
            workerExecutor.execute(() -> workerLoop(workerId));
        }
        LOG.infof("Dispatcher started with %d workers, lane weights %s", settings.dispatcherWorkers(), schedule);
    }

    /**
     * Stops taking new deliveries. Jobs in flight finish on their own; queued deliveries stay in
     * memory and are picked up again from the job store on the next startup.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            LOG.infof("Dispatcher stopping, %d deliveries left in lanes", totalQueued());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public int queueDepth(JobPriority priority) {
        return lanes.get(priority).size();
    }

    /**
     * Places a delivery on the lane matching its priority.
     */
    public void dispatch(JobDelivery delivery) {
        lanes.get(delivery.priority()).add(delivery);
        available.release();
        LOG.debugf("Job %s: queued on %s lane (attempt %d)", delivery.jobId(), delivery.priority(), delivery.attempt() + 1);
    }

    JobDelivery takeNext() {
        JobPriority preferred = schedule.get((int) (ticket.getAndIncrement() % schedule.size()));
        JobDelivery delivery = lanes.get(preferred).poll();
        if (delivery != null) {
            return delivery;
        }
        for (JobPriority priority : JobPriority.values()) {
            delivery = lanes.get(priority).poll();
            if (delivery != null) {
                return delivery;
            }
        }
        return null;
    }

    private void workerLoop(int workerId) {
        activeWorkers.incrementAndGet();
        LOG.debugf("Dispatcher worker %d started", workerId);
        try {
            while (running.get()) {
                if (!available.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    continue;
                }
                JobDelivery delivery = takeNext();
                if (delivery == null) {
                    LOG.warnf("Dispatcher worker %d: permit without delivery", workerId);
                    continue;
                }
                try {
                    process(delivery);
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Dispatcher worker %d: unexpected error handling job %s", workerId, delivery.jobId());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeWorkers.decrementAndGet();
            LOG.debugf("Dispatcher worker %d stopped", workerId);
        }
    }

    /**
     * Runs one delivery under its lane's hard time limit and applies the retry policy.
     */
    void process(JobDelivery delivery) throws InterruptedException {
        Duration limit = settings.hardTimeLimit(delivery.priority());
        PipelineRun run = new PipelineRun();
        Future<Optional<JobStatus>> future = pipelineExecutor.submit(() -> run.execute(pipeline, delivery));
        try {
            Optional<JobStatus> outcome = future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debugf("Job %s: pipeline ended with %s", delivery.jobId(), outcome.map(Enum::name).orElse("no outcome"));
        } catch (TimeoutException e) {
            run.interrupt();
            future.cancel(true);
            failOnHardLimit(delivery, limit);
        } catch (ExecutionException e) {
            handleFailure(delivery, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            run.interrupt();
            future.cancel(true);
            throw e;
        }
    }

    private void failOnHardLimit(JobDelivery delivery, Duration limit) {
        String reason = String.format("Job exceeded hard time limit of %ds on %s lane",
                limit.toSeconds(), delivery.priority());
        LOG.errorf("Job %s: %s, pipeline interrupted", delivery.jobId(), reason);
        markFailed(delivery, reason);
        metrics.jobFinished(JobStatus.FAILED, limit);
    }

    private void handleFailure(JobDelivery delivery, Throwable cause) {
        if (delivery.attempt() < settings.maxRetries()) {
            LOG.warnf(cause, "Job %s: delivery %d failed, redelivering", delivery.jobId(), delivery.attempt() + 1);
            dispatch(delivery.redelivered());
            return;
        }
        String reason = String.format("Job failed after %d deliveries: %s", delivery.attempt() + 1, cause.getMessage());
        LOG.errorf(cause, "Job %s: %s", delivery.jobId(), reason);
        markFailed(delivery, reason);
        metrics.jobFinished(JobStatus.FAILED, Duration.ZERO);
    }

    private void markFailed(JobDelivery delivery, String reason) {
        try {
            store.update(delivery.jobId(), JobUpdate.builder()
                    .status(JobStatus.FAILED)
                    .reason(reason)
                    .progress(100)
                    .completedAt(clock.instant())
                    .build());
        } catch (JobStoreException e) {
            LOG.errorf(e, "Job %s: could not record failure", delivery.jobId());
        }
    }

    private int totalQueued() {
        return lanes.values().stream().mapToInt(BlockingQueue::size).sum();
    }

    /**
     * Tracks the thread running one pipeline so that only that run is interrupted.
     */
    private static final class PipelineRun {
        private Thread runner;
        private boolean interrupted;

        Optional<JobStatus> execute(CrackingPipeline pipeline, JobDelivery delivery) {
            synchronized (this) {
                if (interrupted) {
                    return Optional.empty();
                }
                runner = Thread.currentThread();
            }
            try {
                return pipeline.execute(delivery);
            } finally {
                synchronized (this) {
                    runner = null;
                    Thread.interrupted();
                }
            }
        }

        synchronized void interrupt() {
            interrupted = true;
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}
