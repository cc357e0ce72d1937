/* (C)2026 */
package com.ammann.nearmiss.service;

import com.ammann.nearmiss.dto.CloseCallDTO;
import com.ammann.nearmiss.dto.NearMissRateDTO;
import com.ammann.nearmiss.dto.SeverityAnalysisDTO;
import com.ammann.nearmiss.dto.SeverityStatsDTO;
import com.ammann.nearmiss.dto.TimeSeriesPointDTO;
import com.ammann.nearmiss.dto.TopOffenderDTO;
import com.ammann.nearmiss.dto.ZoneAnalysisDTO;
import com.ammann.nearmiss.dto.ZoneStatsDTO;
import com.ammann.nearmiss.enumeration.Severity;
import jakarta.enterprise.context.ApplicationScoped;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reduces a close-call list into reporting KPIs.
 *
 * <p>Every operation is a pure function of its input list; no matching is repeated and
 * no state is kept between calls. An empty list always yields zero-valued, non-null
 * structures. Ties are broken by a fixed total order (tracking id, zone id) so the
 * result does not depend on the order of the input list.
 */
@ApplicationScoped
public class CloseCallKpiAggregator {

    private static final Logger LOG = Logger.getLogger(CloseCallKpiAggregator.class);

    static final int TOP_OFFENDER_LIMIT = 10;
    static final double DEFAULT_OBSERVATION_WINDOW_MINUTES = 60.0;

    /**
     * Observation window used for the near-miss rate when neither the query bounds nor
     * the close-call timestamps define one.
     */
    @ConfigProperty(
            name = "nearmiss.close-call.default-observation-window-minutes",
            defaultValue = "60")
    double defaultObservationWindowMinutes = DEFAULT_OBSERVATION_WINDOW_MINUTES;

    /**
     * Computes all KPIs over one close-call list.
     *
     * @param closeCalls close calls of one computation
     * @param from caller-supplied window start, may be {@code null}
     * @param to caller-supplied window end, may be {@code null}
     * @return aggregated KPIs
     */
    public CloseCallKpis aggregate(List<CloseCallDTO> closeCalls, Instant from, Instant to) {
        long start = System.nanoTime();

        CloseCallKpis kpis =
                new CloseCallKpis(
                        timeSeries(closeCalls),
                        topOffenders(closeCalls),
                        zoneAnalysis(closeCalls),
                        nearMissRate(closeCalls, from, to),
                        severityAnalysis(closeCalls));

        LOG.debugf(
                "Aggregation took %.2fms for %d close calls",
                (System.nanoTime() - start) / 1_000_000.0, closeCalls.size());
        return kpis;
    }

    /**
     * Zero-valued KPIs for computations that skip aggregation or had nothing to aggregate.
     */
    public CloseCallKpis empty() {
        return new CloseCallKpis(
                List.of(),
                List.of(),
                ZoneAnalysisDTO.empty(),
                NearMissRateDTO.empty(round(defaultObservationWindowMinutes, 2)),
                SeverityAnalysisDTO.empty());
    }

    /**
     * Counts close calls per minute of the human observation. Sparse: minutes without
     * close calls are omitted.
     *
     * @return points ascending by minute
     */
    public List<TimeSeriesPointDTO> timeSeries(List<CloseCallDTO> closeCalls) {
        Map<Instant, Long> perMinute = new TreeMap<>();
        for (CloseCallDTO closeCall : closeCalls) {
            perMinute.merge(closeCall.minuteBucket(), 1L, Long::sum);
        }

        List<TimeSeriesPointDTO> series = new ArrayList<>(perMinute.size());
        perMinute.forEach((minute, count) -> series.add(new TimeSeriesPointDTO(minute, count)));
        return series;
    }

    /**
     * Ranks vehicles by close-call count.
     *
     * <p>Exposure is the number of distinct minute buckets in which the vehicle had a close
     * call. Ties in count are broken by vehicle tracking id ascending.
     *
     * @return at most {@value #TOP_OFFENDER_LIMIT} entries, descending by close calls
     */
    public List<TopOffenderDTO> topOffenders(List<CloseCallDTO> closeCalls) {
        Map<String, Long> counts = new HashMap<>();
        Map<String, Set<Instant>> exposure = new HashMap<>();

        for (CloseCallDTO closeCall : closeCalls) {
            String vehicleId = closeCall.vehicleTrackingId();
            counts.merge(vehicleId, 1L, Long::sum);
            exposure.computeIfAbsent(vehicleId, id -> new HashSet<>()).add(closeCall.minuteBucket());
        }

        List<TopOffenderDTO> offenders = new ArrayList<>(counts.size());
        counts.forEach(
                (vehicleId, count) -> {
                    long exposureMinutes = exposure.get(vehicleId).size();
                    double rate = exposureMinutes > 0 ? (double) count / exposureMinutes : 0.0;
                    offenders.add(
                            new TopOffenderDTO(vehicleId, count, exposureMinutes, round(rate, 3)));
                });

        offenders.sort(
                Comparator.comparingLong(TopOffenderDTO::closeCalls)
                        .reversed()
                        .thenComparing(TopOffenderDTO::vehicleId));

        return offenders.size() > TOP_OFFENDER_LIMIT
                ? List.copyOf(offenders.subList(0, TOP_OFFENDER_LIMIT))
                : List.copyOf(offenders);
    }

    /**
     * Groups close calls by the vehicle's zone, falling back to the human's zone. Close
     * calls without any zone are not counted.
     *
     * <p>The worst zone is the one with the highest count; ties go to the lexicographically
     * smallest zone id.
     */
    public ZoneAnalysisDTO zoneAnalysis(List<CloseCallDTO> closeCalls) {
        Map<String, DoubleSummaryStatistics> byZone = new TreeMap<>();
        for (CloseCallDTO closeCall : closeCalls) {
            String zone = closeCall.effectiveZone();
            if (zone != null) {
                byZone.computeIfAbsent(zone, z -> new DoubleSummaryStatistics())
                        .accept(closeCall.distance());
            }
        }

        if (byZone.isEmpty()) {
            return ZoneAnalysisDTO.empty();
        }

        String worstZone = null;
        long worstCount = -1;
        Map<String, ZoneStatsDTO> stats = new LinkedHashMap<>();

        // TreeMap iteration is ascending, so strict '>' keeps the smallest id on ties.
        for (Map.Entry<String, DoubleSummaryStatistics> entry : byZone.entrySet()) {
            DoubleSummaryStatistics distances = entry.getValue();
            stats.put(
                    entry.getKey(),
                    new ZoneStatsDTO(
                            distances.getCount(),
                            round(distances.getAverage(), 2),
                            round(distances.getMin(), 2),
                            round(distances.getMax(), 2)));

            if (distances.getCount() > worstCount) {
                worstCount = distances.getCount();
                worstZone = entry.getKey();
            }
        }

        return new ZoneAnalysisDTO(worstZone, Collections.unmodifiableMap(stats));
    }

    /**
     * Close calls per 100 vehicle-minutes, where vehicle-minutes is the number of distinct
     * vehicles times the observation window length.
     *
     * @param from caller-supplied window start, may be {@code null}
     * @param to caller-supplied window end, may be {@code null}
     */
    public NearMissRateDTO nearMissRate(List<CloseCallDTO> closeCalls, Instant from, Instant to) {
        double observationMinutes = observationWindowMinutes(closeCalls, from, to);

        if (closeCalls.isEmpty()) {
            return NearMissRateDTO.empty(round(observationMinutes, 2));
        }

        long uniqueVehicles =
                closeCalls.stream().map(CloseCallDTO::vehicleTrackingId).distinct().count();
        double vehicleMinutes = uniqueVehicles * observationMinutes;
        double ratePer100 = vehicleMinutes > 0 ? (closeCalls.size() / vehicleMinutes) * 100.0 : 0.0;

        return new NearMissRateDTO(
                round(ratePer100, 2),
                round(vehicleMinutes, 2),
                uniqueVehicles,
                round(observationMinutes, 2));
    }

    /**
     * Count, share and mean distance for each severity tier. All tiers are always present.
     */
    public SeverityAnalysisDTO severityAnalysis(List<CloseCallDTO> closeCalls) {
        Map<Severity, DoubleSummaryStatistics> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, new DoubleSummaryStatistics());
        }
        for (CloseCallDTO closeCall : closeCalls) {
            bySeverity.get(closeCall.severity()).accept(closeCall.distance());
        }

        int total = closeCalls.size();
        Map<Severity, SeverityStatsDTO> stats = new EnumMap<>(Severity.class);
        bySeverity.forEach(
                (severity, distances) -> {
                    long count = distances.getCount();
                    double percentage = total > 0 ? (count * 100.0) / total : 0.0;
                    double avgDistance = count > 0 ? distances.getAverage() : 0.0;
                    stats.put(
                            severity,
                            new SeverityStatsDTO(count, round(percentage, 1), round(avgDistance, 2)));
                });

        return new SeverityAnalysisDTO(
                stats.get(Severity.HIGH), stats.get(Severity.MEDIUM), stats.get(Severity.LOW));
    }

    /**
     * Resolves the observation window length: the caller's bounds when both are given,
     * else the span of the close-call timestamps when positive, else the configured default.
     */
    double observationWindowMinutes(List<CloseCallDTO> closeCalls, Instant from, Instant to) {
        if (from != null && to != null) {
            return Duration.between(from, to).toMillis() / 60_000.0;
        }

        if (!closeCalls.isEmpty()) {
            Instant min = closeCalls.get(0).timestamp();
            Instant max = min;
            for (CloseCallDTO closeCall : closeCalls) {
                if (closeCall.timestamp().isBefore(min)) min = closeCall.timestamp();
                if (closeCall.timestamp().isAfter(max)) max = closeCall.timestamp();
            }
            long spanMs = Duration.between(min, max).toMillis();
            if (spanMs > 0) {
                return spanMs / 60_000.0;
            }
        }

        return defaultObservationWindowMinutes;
    }

    /** Rounds half-up to the given number of decimals; non-finite input becomes 0. */
    static double round(double value, int decimals) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * KPI substructures of one computation.
     */
    public record CloseCallKpis(
            List<TimeSeriesPointDTO> timeSeries,
            List<TopOffenderDTO> topOffenders,
            ZoneAnalysisDTO zoneAnalysis,
            NearMissRateDTO nearMissRate,
            SeverityAnalysisDTO severityAnalysis) {}
}
