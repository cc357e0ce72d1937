/* (C)2026 */
package com.ammann.nearmiss.service;

import com.ammann.nearmiss.dto.CloseCallDTO;
import com.ammann.nearmiss.dto.CloseCallKpiResultDTO;
import com.ammann.nearmiss.dto.CloseCallParametersDTO;
import com.ammann.nearmiss.dto.CloseCallQueryDTO;
import com.ammann.nearmiss.dto.ComputationStatisticsDTO;
import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.exception.ComputationException;
import com.ammann.nearmiss.exception.ValidationException;
import com.ammann.nearmiss.model.Observation;
import com.ammann.nearmiss.service.CloseCallKpiAggregator.CloseCallKpis;
import com.ammann.nearmiss.source.TrajectoryQuery;
import com.ammann.nearmiss.source.TrajectorySource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Entry point of the near-miss engine: computes close calls and their KPIs for one query.
 *
 * <p>Flow per call: validate parameters, fetch human observations for the query window,
 * fetch vehicle observations for the human time span widened by the time window, index
 * the vehicles, match, aggregate. The service keeps no state between calls, so concurrent
 * computations are independent.
 *
 * <p>Errors: parameter problems raise {@link ValidationException} before anything is
 * fetched. Any other runtime failure is reported as a {@link ComputationException}.
 */
@ApplicationScoped
public class CloseCallKpiService {

    private static final Logger LOG = Logger.getLogger(CloseCallKpiService.class);

    static final double DEFAULT_DISTANCE_THRESHOLD = 2.0;
    static final long DEFAULT_TIME_WINDOW_MS = 250L;

    @ConfigProperty(name = "nearmiss.close-call.default-distance-threshold", defaultValue = "2.0")
    double defaultDistanceThreshold = DEFAULT_DISTANCE_THRESHOLD;

    @ConfigProperty(name = "nearmiss.close-call.default-time-window-ms", defaultValue = "250")
    long defaultTimeWindowMs = DEFAULT_TIME_WINDOW_MS;

    @ConfigProperty(name = "nearmiss.close-call.default-batch-size", defaultValue = "200")
    int defaultBatchSize = ProximityMatcherService.DEFAULT_BATCH_SIZE;

    private final TrajectorySource trajectorySource;
    private final ProximityMatcherService matcher;
    private final CloseCallKpiAggregator aggregator;

    private Counter closeCallsCounter;
    private Counter failuresCounter;
    private Timer computationTimer;

    @Inject
    public CloseCallKpiService(
            TrajectorySource trajectorySource,
            ProximityMatcherService matcher,
            CloseCallKpiAggregator aggregator,
            MeterRegistry meterRegistry) {
        this.trajectorySource = trajectorySource;
        this.matcher = matcher;
        this.aggregator = aggregator;
        initMetrics(meterRegistry);
    }

    /**
     * Computes close calls and all KPIs.
     *
     * @param query caller parameters; unset values take configured defaults
     * @return complete result, zero-valued when either stream is empty
     * @throws ValidationException if a parameter is out of range
     * @throws ComputationException on any unexpected failure during computation
     */
    public CloseCallKpiResultDTO computeKpis(CloseCallQueryDTO query) {
        CloseCallParametersDTO params = resolveParameters(query);
        long start = System.nanoTime();

        try {
            MatchRun run = runMatching(params);

            CloseCallKpis kpis;
            if (params.includeKpis()) {
                kpis = aggregator.aggregate(run.closeCalls(), params.fromTime(), params.toTime());
            } else {
                CloseCallKpis empty = aggregator.empty();
                kpis = new CloseCallKpis(
                        aggregator.timeSeries(run.closeCalls()),
                        empty.topOffenders(),
                        empty.zoneAnalysis(),
                        empty.nearMissRate(),
                        empty.severityAnalysis());
            }

            long elapsedNanos = System.nanoTime() - start;
            double elapsedMs = Math.round(elapsedNanos / 10_000.0) / 100.0;

            var statistics =
                    new ComputationStatisticsDTO(
                            run.humansProcessed(),
                            run.vehiclesProcessed(),
                            run.closeCalls().size(),
                            elapsedMs);

            recordMetrics(run.closeCalls().size(), elapsedNanos);

            LOG.infof(
                    "Close-call computation completed in %.2fms: humans=%d, vehicles=%d, closeCalls=%d",
                    elapsedMs,
                    run.humansProcessed(),
                    run.vehiclesProcessed(),
                    run.closeCalls().size());

            return new CloseCallKpiResultDTO(
                    run.closeCalls().size(),
                    params.includeDetails() ? run.closeCalls() : List.of(),
                    kpis.timeSeries(),
                    kpis.topOffenders(),
                    kpis.zoneAnalysis(),
                    kpis.nearMissRate(),
                    kpis.severityAnalysis(),
                    statistics,
                    params,
                    Instant.now());
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            increment(failuresCounter);
            LOG.errorf(e, "Close-call computation failed for %s", query);
            throw new ComputationException(e);
        }
    }

    /**
     * Computes only the close-call list, for callers that persist or post-process it.
     *
     * @param query caller parameters; unset values take configured defaults
     * @return close calls in matching order
     * @throws ValidationException if a parameter is out of range
     * @throws ComputationException on any unexpected failure during computation
     */
    public List<CloseCallDTO> detectCloseCalls(CloseCallQueryDTO query) {
        CloseCallParametersDTO params = resolveParameters(query);
        try {
            List<CloseCallDTO> closeCalls = runMatching(params).closeCalls();
            increment(closeCallsCounter, closeCalls.size());
            return closeCalls;
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            increment(failuresCounter);
            LOG.errorf(e, "Close-call detection failed for %s", query);
            throw new ComputationException(e);
        }
    }

    /**
     * Applies defaults and validates every parameter.
     *
     * @throws ValidationException on the first invalid parameter
     */
    CloseCallParametersDTO resolveParameters(CloseCallQueryDTO query) {
        if (query == null) {
            query = new CloseCallQueryDTO();
        }

        double distanceThreshold =
                query.distanceThreshold != null ? query.distanceThreshold : defaultDistanceThreshold;
        long timeWindowMs = query.timeWindowMs != null ? query.timeWindowMs : defaultTimeWindowMs;
        int batchSize = query.batchSize != null ? query.batchSize : defaultBatchSize;

        if (!(distanceThreshold > 0) || Double.isInfinite(distanceThreshold)) {
            throw ValidationException.invalidParameter(
                    "distance_threshold", distanceThreshold, "finite value > 0");
        }
        if (timeWindowMs < 0 || timeWindowMs > ProximityMatcherService.MAX_TIME_WINDOW_MS) {
            throw ValidationException.invalidParameter(
                    "time_window_ms",
                    timeWindowMs,
                    "integer in [0, " + ProximityMatcherService.MAX_TIME_WINDOW_MS + "]");
        }
        if (batchSize <= 0) {
            throw ValidationException.invalidParameter("batch_size", batchSize, "positive integer");
        }
        if (query.fromTime != null && query.toTime != null && !query.fromTime.isBefore(query.toTime)) {
            throw ValidationException.invalidRange(query.fromTime, query.toTime);
        }
        if (query.vehicleClass != null && !query.vehicleClass.isVehicle()) {
            throw ValidationException.invalidParameter(
                    "vehicle_class", query.vehicleClass.getCode(), "one of vehicle, pallet_truck, agv");
        }

        String zone = query.zone == null || query.zone.isBlank() ? null : query.zone;

        return new CloseCallParametersDTO(
                distanceThreshold,
                timeWindowMs,
                query.fromTime,
                query.toTime,
                zone,
                query.vehicleClass,
                batchSize,
                query.includeKpis == null || query.includeKpis,
                query.includeDetails == null || query.includeDetails);
    }

    private MatchRun runMatching(CloseCallParametersDTO params) {
        List<Observation> humans =
                trajectorySource.fetch(
                        TrajectoryQuery.humans(params.fromTime(), params.toTime(), params.zone()));

        if (humans.isEmpty()) {
            LOG.debugf("No human observations for %s", params);
            return new MatchRun(0, 0, List.of());
        }

        humans = ensureTimeOrdered(humans);

        // Humans at the window edge may pair with vehicles just outside it.
        Instant vehicleFrom = humans.get(0).timestamp().minusMillis(params.timeWindowMs());
        Instant vehicleTo = humans.get(humans.size() - 1).timestamp().plusMillis(params.timeWindowMs());

        List<Observation> vehicles =
                trajectorySource.fetch(
                        TrajectoryQuery.vehicles(
                                vehicleFrom, vehicleTo, params.zone(), params.vehicleClass()));

        if (vehicles.isEmpty()) {
            LOG.debugf("No vehicle observations between %s and %s", vehicleFrom, vehicleTo);
            return new MatchRun(humans.size(), 0, List.of());
        }

        TimeWindowIndex index = TimeWindowIndex.build(vehicles);
        List<CloseCallDTO> closeCalls =
                matcher.findCloseCalls(
                        humans,
                        index,
                        params.distanceThreshold(),
                        params.timeWindowMs(),
                        params.batchSize());

        return new MatchRun(humans.size(), vehicles.size(), closeCalls);
    }

    private static List<Observation> ensureTimeOrdered(List<Observation> observations) {
        if (TimeWindowIndex.isTimeOrdered(observations)) {
            return observations;
        }
        LOG.warnf("Trajectory source returned %d unordered rows, sorting", observations.size());
        List<Observation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(Observation::timestamp));
        return sorted;
    }

    /**
     * Initialize Prometheus metrics.
     * Safe to call even if meterRegistry is null.
     */
    private void initMetrics(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        closeCallsCounter =
                Counter.builder("nearmiss_close_calls_detected_total")
                        .description("Total close calls detected")
                        .register(meterRegistry);

        failuresCounter =
                Counter.builder("nearmiss_computation_failures_total")
                        .description("Total failed close-call computations")
                        .register(meterRegistry);

        computationTimer =
                Timer.builder("nearmiss_computation_duration")
                        .description("Duration of close-call KPI computations")
                        .register(meterRegistry);
    }

    private void recordMetrics(int closeCalls, long elapsedNanos) {
        increment(closeCallsCounter, closeCalls);
        if (computationTimer != null) {
            computationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        }
    }

    private static void increment(Counter counter) {
        increment(counter, 1);
    }

    private static void increment(Counter counter, long amount) {
        if (counter != null) {
            counter.increment(amount);
        }
    }

    /**
     * Matching output together with the stream sizes it was computed from.
     */
    record MatchRun(int humansProcessed, int vehiclesProcessed, List<CloseCallDTO> closeCalls) {}
}
