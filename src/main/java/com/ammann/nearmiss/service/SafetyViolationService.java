/* (C)2026 */
package com.ammann.nearmiss.service;

import com.ammann.nearmiss.dto.OverspeedEventDTO;
import com.ammann.nearmiss.dto.SafetyKpiResultDTO;
import com.ammann.nearmiss.dto.SafetyParametersDTO;
import com.ammann.nearmiss.dto.SafetyQueryDTO;
import com.ammann.nearmiss.dto.SafetyStatisticsDTO;
import com.ammann.nearmiss.dto.VestViolationDTO;
import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.exception.ComputationException;
import com.ammann.nearmiss.exception.ValidationException;
import com.ammann.nearmiss.model.Observation;
import com.ammann.nearmiss.source.TrajectoryQuery;
import com.ammann.nearmiss.source.TrajectorySource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Detects vest violations and overspeed events and computes their KPIs.
 *
 * <p>A vest violation is a human observation whose vest state is explicitly
 * {@code false}; an unknown state is not a violation. An overspeed event is an
 * observation of a speed-checked class whose effective speed is strictly above the
 * speed threshold. The effective speed is the raw feed speed when usable, else the
 * derived speed of the object's whole trajectory in the query window (not restricted
 * to the zone filter).
 */
@ApplicationScoped
public class SafetyViolationService {

    private static final Logger LOG = Logger.getLogger(SafetyViolationService.class);

    static final double DEFAULT_SPEED_THRESHOLD = 1.5;

    @ConfigProperty(name = "nearmiss.safety.default-speed-threshold", defaultValue = "1.5")
    double defaultSpeedThreshold = DEFAULT_SPEED_THRESHOLD;

    private final TrajectorySource trajectorySource;
    private final DerivedSpeedService derivedSpeedService;
    private final SafetyKpiAggregator aggregator;

    private Counter vestViolationsCounter;
    private Counter overspeedEventsCounter;
    private Counter failuresCounter;
    private Timer computationTimer;

    @Inject
    public SafetyViolationService(
            TrajectorySource trajectorySource,
            DerivedSpeedService derivedSpeedService,
            SafetyKpiAggregator aggregator,
            MeterRegistry meterRegistry) {
        this.trajectorySource = trajectorySource;
        this.derivedSpeedService = derivedSpeedService;
        this.aggregator = aggregator;
        initMetrics(meterRegistry);
    }

    /**
     * Computes vest violations, overspeed events and their KPIs.
     *
     * @param query caller parameters; an unset speed threshold takes the configured default
     * @return complete result, zero-valued when nothing was observed
     * @throws ValidationException if a parameter is out of range
     * @throws ComputationException on any unexpected failure during computation
     */
    public SafetyKpiResultDTO computeSafetyKpis(SafetyQueryDTO query) {
        SafetyParametersDTO params = resolveParameters(query);
        long start = System.nanoTime();

        try {
            List<Observation> humans =
                    trajectorySource.fetch(
                            TrajectoryQuery.humans(params.fromTime(), params.toTime(), params.zone()));
            List<VestViolationDTO> vestViolations = detectVestViolations(humans);

            Set<ObjectClass> speedClasses = speedCheckedClasses(params.includeHumansInSpeed());
            List<Observation> speedCandidates =
                    trajectorySource.fetch(
                            TrajectoryQuery.of(
                                    speedClasses, params.fromTime(), params.toTime(), params.zone()));
            Map<String, Double> derivedSpeeds = deriveMissingSpeeds(speedCandidates, speedClasses, params);
            List<OverspeedEventDTO> overspeedEvents =
                    detectOverspeedEvents(speedCandidates, derivedSpeeds, params.speedThreshold());

            long elapsedNanos = System.nanoTime() - start;
            double elapsedMs = Math.round(elapsedNanos / 10_000.0) / 100.0;

            var statistics =
                    new SafetyStatisticsDTO(
                            humans.size(),
                            speedCandidates.size(),
                            vestViolations.size(),
                            overspeedEvents.size(),
                            aggregator.uniqueHumans(vestViolations),
                            aggregator.uniqueVehicles(overspeedEvents),
                            elapsedMs);

            recordMetrics(vestViolations.size(), overspeedEvents.size(), elapsedNanos);

            LOG.infof(
                    "Safety computation completed in %.2fms: humans=%d, speedChecked=%d, vestViolations=%d, overspeedEvents=%d",
                    elapsedMs,
                    humans.size(),
                    speedCandidates.size(),
                    vestViolations.size(),
                    overspeedEvents.size());

            return new SafetyKpiResultDTO(
                    aggregator.topCards(vestViolations, overspeedEvents, humans.size()),
                    params.includeDetails() ? vestViolations : List.of(),
                    params.includeDetails() ? overspeedEvents : List.of(),
                    aggregator.timeSeries(vestViolations, overspeedEvents),
                    aggregator.zoneAnalysis(vestViolations, overspeedEvents),
                    aggregator.repeatOffenders(
                            vestViolations, overspeedEvents, params.fromTime(), params.toTime()),
                    statistics,
                    params,
                    Instant.now());
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            increment(failuresCounter, 1);
            LOG.errorf(e, "Safety violation computation failed for %s", query);
            throw new ComputationException("Safety violation computation failed", e);
        }
    }

    /**
     * Applies defaults and validates every parameter.
     *
     * @throws ValidationException on the first invalid parameter
     */
    SafetyParametersDTO resolveParameters(SafetyQueryDTO query) {
        if (query == null) {
            query = new SafetyQueryDTO();
        }

        double speedThreshold =
                query.speedThreshold != null ? query.speedThreshold : defaultSpeedThreshold;
        if (!(speedThreshold >= 0) || Double.isInfinite(speedThreshold)) {
            throw ValidationException.invalidParameter(
                    "speed_threshold", speedThreshold, "finite value >= 0");
        }
        if (query.fromTime != null && query.toTime != null && !query.fromTime.isBefore(query.toTime)) {
            throw ValidationException.invalidRange(query.fromTime, query.toTime);
        }

        String zone = query.zone == null || query.zone.isBlank() ? null : query.zone;

        return new SafetyParametersDTO(
                query.fromTime,
                query.toTime,
                zone,
                speedThreshold,
                query.includeHumansInSpeed != null && query.includeHumansInSpeed,
                query.includeDetails == null || query.includeDetails);
    }

    List<VestViolationDTO> detectVestViolations(List<Observation> humans) {
        List<VestViolationDTO> violations = new ArrayList<>();
        for (Observation human : humans) {
            if (Boolean.FALSE.equals(human.vest())) {
                violations.add(VestViolationDTO.of(human));
            }
        }
        return violations;
    }

    List<OverspeedEventDTO> detectOverspeedEvents(
            List<Observation> observations, Map<String, Double> derivedSpeeds, double speedThreshold) {
        List<OverspeedEventDTO> events = new ArrayList<>();
        for (Observation observation : observations) {
            double speed = derivedSpeedService.resolveSpeed(observation, derivedSpeeds);
            if (speed > speedThreshold) {
                events.add(OverspeedEventDTO.of(observation, speed, speedThreshold));
            }
        }
        return events;
    }

    /**
     * Derives speeds for the trajectories that have at least one reading without a usable
     * raw speed. Trajectories are read over the whole query window; with a zone filter
     * that needs a second, zone-less fetch.
     */
    private Map<String, Double> deriveMissingSpeeds(
            List<Observation> speedCandidates, Set<ObjectClass> speedClasses, SafetyParametersDTO params) {
        Set<String> needsDerivation = new HashSet<>();
        for (Observation observation : speedCandidates) {
            if (!observation.hasSpeed()) {
                needsDerivation.add(observation.trackingId());
            }
        }
        if (needsDerivation.isEmpty()) {
            return Map.of();
        }

        List<Observation> trajectories =
                params.zone() == null
                        ? speedCandidates
                        : trajectorySource.fetch(
                                TrajectoryQuery.of(speedClasses, params.fromTime(), params.toTime(), null));

        List<Observation> rows = new ArrayList<>();
        for (Observation observation : trajectories) {
            if (needsDerivation.contains(observation.trackingId())) {
                rows.add(observation);
            }
        }

        LOG.debugf("Deriving speed for %d trajectories without raw speed", needsDerivation.size());
        return derivedSpeedService.deriveSpeeds(rows);
    }

    private static Set<ObjectClass> speedCheckedClasses(boolean includeHumans) {
        Set<ObjectClass> classes = ObjectClass.vehicleClasses();
        if (includeHumans) {
            classes.add(ObjectClass.HUMAN);
        }
        return classes;
    }

    /**
     * Initialize Prometheus metrics.
     * Safe to call even if meterRegistry is null.
     */
    private void initMetrics(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - safety metrics disabled");
            return;
        }

        vestViolationsCounter =
                Counter.builder("nearmiss_vest_violations_detected_total")
                        .description("Total vest violations detected")
                        .register(meterRegistry);

        overspeedEventsCounter =
                Counter.builder("nearmiss_overspeed_events_detected_total")
                        .description("Total overspeed events detected")
                        .register(meterRegistry);

        failuresCounter =
                Counter.builder("nearmiss_safety_computation_failures_total")
                        .description("Total failed safety violation computations")
                        .register(meterRegistry);

        computationTimer =
                Timer.builder("nearmiss_safety_computation_duration")
                        .description("Duration of safety violation computations")
                        .register(meterRegistry);
    }

    private void recordMetrics(int vestViolations, int overspeedEvents, long elapsedNanos) {
        increment(vestViolationsCounter, vestViolations);
        increment(overspeedEventsCounter, overspeedEvents);
        if (computationTimer != null) {
            computationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        }
    }

    private static void increment(Counter counter, long amount) {
        if (counter != null) {
            counter.increment(amount);
        }
    }
}
