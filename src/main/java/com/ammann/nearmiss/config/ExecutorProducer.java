/* (C)2026 */
package com.ammann.nearmiss.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "proximity-batch-executor" bean used by ProximityMatcherService
 * when parallel batch matching is enabled. Batches are independent, so the executor
 * only needs plain worker threads and no transaction context.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String PROXIMITY_BATCH_EXECUTOR = "proximity-batch-executor";

    @ConfigProperty(name = "nearmiss.matcher.max-threads", defaultValue = "4")
    int maxThreads;

    @ConfigProperty(name = "nearmiss.matcher.queue-size", defaultValue = "256")
    int queueSize;

    /**
     * Produces a named ManagedExecutor for proximity matching batches.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>nearmiss.matcher.max-threads</li>
     *   <li>nearmiss.matcher.queue-size</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(PROXIMITY_BATCH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createProximityBatchExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxThreads)
                .maxQueued(queueSize)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
