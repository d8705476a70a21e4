/* (C)2026 */
package com.ammann.hashbreaker.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor instances used by the priority dispatcher.
 *
 * <p>Two pools with the same size are needed: one runs the lane-polling worker loops, the other
 * runs the pipeline itself so that a worker can enforce its lane's hard time limit on it.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String WORKER_EXECUTOR = "dispatcher-worker-executor";
    public static final String PIPELINE_EXECUTOR = "pipeline-executor";

    @ConfigProperty(name = "hash-breaker.dispatcher.workers", defaultValue = "4")
    int workers;

    /**
     * Produces the executor that hosts one long-running polling loop per dispatcher worker.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(WORKER_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createWorkerExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(workers)
                .maxQueued(workers)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    /**
     * Produces the executor that runs cracking pipelines. At most one pipeline per worker is in
     * flight, plus abandoned ones still winding down after a hard-limit kill.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(PIPELINE_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createPipelineExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(workers * 2)
                .maxQueued(workers * 2)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    void shutdown(@Disposes @Named(WORKER_EXECUTOR) ManagedExecutor executor) {
        executor.shutdownNow();
    }

    void shutdownPipelines(@Disposes @Named(PIPELINE_EXECUTOR) ManagedExecutor executor) {
        executor.shutdownNow();
    }
}
