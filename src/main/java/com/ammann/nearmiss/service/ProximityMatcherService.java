/* (C)2026 */
package com.ammann.nearmiss.service;

import com.ammann.nearmiss.config.ExecutorProducer;
import com.ammann.nearmiss.dto.CloseCallDTO;
import com.ammann.nearmiss.exception.ValidationException;
import com.ammann.nearmiss.model.Observation;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Windowed spatio-temporal join between human and vehicle observations.
 *
 * <p>For every human observation the vehicle candidates inside the time window are
 * located through a {@link TimeWindowIndex}; each candidate is accepted when its squared
 * planar distance does not exceed the squared threshold. The square root is only taken
 * for accepted pairs. Cost is {@code O(H log V + H k)} for {@code k} candidates per human.
 *
 * <p>Humans are processed in fixed-size batches. Batching never changes the output:
 * close calls are emitted in human order, then candidate order, whether batches run
 * sequentially or on the proximity batch executor. In parallel mode at most
 * {@code nearmiss.matcher.max-threads} workers are submitted; each worker pulls batches
 * until none are left, so the executor queue never holds more than that many tasks.
 */
@ApplicationScoped
public class ProximityMatcherService {

    private static final Logger LOG = Logger.getLogger(ProximityMatcherService.class);

    static final int DEFAULT_BATCH_SIZE = 200;
    static final long MAX_TIME_WINDOW_MS = Integer.MAX_VALUE;

    private final Executor batchExecutor;
    private final boolean parallelEnabled;
    private final int maxWorkers;

    @Inject
    public ProximityMatcherService(
            @Named(ExecutorProducer.PROXIMITY_BATCH_EXECUTOR) Executor batchExecutor,
            @ConfigProperty(name = "nearmiss.matcher.parallel-enabled", defaultValue = "false")
                    boolean parallelEnabled,
            @ConfigProperty(name = "nearmiss.matcher.max-threads", defaultValue = "4")
                    int maxWorkers) {
        this.batchExecutor = batchExecutor;
        this.parallelEnabled = parallelEnabled;
        this.maxWorkers = Math.max(1, maxWorkers);
    }

    /**
     * Sequential matcher running every batch on the calling thread.
     */
    public ProximityMatcherService() {
        this(Runnable::run, false, 1);
    }

    /**
     * Finds every (human, vehicle) pair with {@code |dt| <= timeWindowMs} and
     * {@code distance <= distanceThreshold}. Both bounds are inclusive.
     *
     * @param humans human observations, ascending by timestamp
     * @param vehicles index over the vehicle observations
     * @param distanceThreshold spatial threshold in meters, positive
     * @param timeWindowMs temporal threshold in milliseconds, non-negative
     * @param batchSize humans per batch, positive
     * @return close calls in human order, then vehicle order; empty if either side is empty
     * @throws ValidationException if a threshold or the batch size is out of range
     */
    public List<CloseCallDTO> findCloseCalls(
            List<Observation> humans,
            TimeWindowIndex vehicles,
            double distanceThreshold,
            long timeWindowMs,
            int batchSize) {

        if (!(distanceThreshold > 0) || Double.isInfinite(distanceThreshold)) {
            throw ValidationException.invalidParameter(
                    "distance_threshold", distanceThreshold, "finite value > 0");
        }
        if (timeWindowMs < 0 || timeWindowMs > MAX_TIME_WINDOW_MS) {
            throw ValidationException.invalidParameter(
                    "time_window_ms", timeWindowMs, "integer in [0, " + MAX_TIME_WINDOW_MS + "]");
        }
        if (batchSize <= 0) {
            throw ValidationException.invalidParameter("batch_size", batchSize, "positive integer");
        }

        if (humans.isEmpty() || vehicles.isEmpty()) {
            LOG.debugf(
                    "Nothing to match: %d humans, %d vehicles", humans.size(), vehicles.size());
            return List.of();
        }

        double thresholdSq = distanceThreshold * distanceThreshold;
        List<List<Observation>> batches = partition(humans, batchSize);

        List<CloseCallDTO> closeCalls;
        if (parallelEnabled && batches.size() > 1) {
            closeCalls = matchInParallel(batches, vehicles, distanceThreshold, thresholdSq, timeWindowMs);
        } else {
            closeCalls = new ArrayList<>();
            for (List<Observation> batch : batches) {
                closeCalls.addAll(
                        matchBatch(batch, vehicles, distanceThreshold, thresholdSq, timeWindowMs));
            }
        }

        LOG.debugf(
                "Matched %d humans against %d vehicles in %d batches: %d close calls",
                humans.size(), vehicles.size(), batches.size(), closeCalls.size());

        return closeCalls;
    }

    private List<CloseCallDTO> matchInParallel(
            List<List<Observation>> batches,
            TimeWindowIndex vehicles,
            double distanceThreshold,
            double thresholdSq,
            long timeWindowMs) {

        AtomicReferenceArray<List<CloseCallDTO>> results = new AtomicReferenceArray<>(batches.size());
        AtomicInteger next = new AtomicInteger();
        Runnable worker =
                () -> {
                    int i;
                    while ((i = next.getAndIncrement()) < batches.size()) {
                        results.set(
                                i,
                                matchBatch(
                                        batches.get(i),
                                        vehicles,
                                        distanceThreshold,
                                        thresholdSq,
                                        timeWindowMs));
                    }
                };

        int workers = Math.min(maxWorkers, batches.size());
        List<CompletableFuture<Void>> futures = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            try {
                futures.add(CompletableFuture.runAsync(worker, batchExecutor));
            } catch (RejectedExecutionException e) {
                // The calling thread drains whatever the submitted workers have not taken.
                LOG.debugf("Batch executor rejected worker %d of %d, matching on caller", w + 1, workers);
                worker.run();
                break;
            }
        }

        try {
            for (CompletableFuture<Void> future : futures) {
                future.join();
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }

        // Concatenated in batch order so the output matches a sequential pass.
        List<CloseCallDTO> closeCalls = new ArrayList<>();
        for (int i = 0; i < results.length(); i++) {
            closeCalls.addAll(results.get(i));
        }
        return closeCalls;
    }

    /** Matches one batch of humans against the vehicle index. */
    private List<CloseCallDTO> matchBatch(
            List<Observation> batch,
            TimeWindowIndex vehicles,
            double distanceThreshold,
            double thresholdSq,
            long timeWindowMs) {

        List<CloseCallDTO> matches = new ArrayList<>();

        for (Observation human : batch) {
            TimeWindowIndex.Range range = vehicles.range(human.timestampMs(), timeWindowMs);
            if (range.isEmpty()) {
                continue;
            }

            double hx = human.x();
            double hy = human.y();

            for (int i = range.lo(); i < range.hi(); i++) {
                Observation vehicle = vehicles.get(i);
                double dx = vehicle.x() - hx;
                double dy = vehicle.y() - hy;
                double distanceSq = dx * dx + dy * dy;

                if (distanceSq <= thresholdSq) {
                    matches.add(
                            CloseCallDTO.of(
                                    human,
                                    vehicle,
                                    Math.sqrt(distanceSq),
                                    distanceThreshold,
                                    timeWindowMs));
                }
            }
        }

        return matches;
    }

    private static List<List<Observation>> partition(List<Observation> rows, int batchSize) {
        List<List<Observation>> batches = new ArrayList<>((rows.size() + batchSize - 1) / batchSize);
        for (int i = 0; i < rows.size(); i += batchSize) {
            batches.add(rows.subList(i, Math.min(rows.size(), i + batchSize)));
        }
        return batches;
    }
}
