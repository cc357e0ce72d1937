/* (C)2026 */
package com.ammann.nearmiss.service;

import static com.ammann.nearmiss.service.CloseCallKpiAggregator.round;

import com.ammann.nearmiss.dto.OverspeedEventDTO;
import com.ammann.nearmiss.dto.RepeatOffenderDTO;
import com.ammann.nearmiss.dto.RepeatOffendersDTO;
import com.ammann.nearmiss.dto.SafetyTimeSeriesPointDTO;
import com.ammann.nearmiss.dto.SafetyTopCardsDTO;
import com.ammann.nearmiss.dto.SafetyZoneAnalysisDTO;
import com.ammann.nearmiss.dto.VestViolationDTO;
import com.ammann.nearmiss.dto.ZoneViolationStatsDTO;
import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.enumeration.ViolationType;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Reduces vest violations and overspeed events into safety KPIs.
 *
 * <p>Pure functions of their inputs, like {@link CloseCallKpiAggregator}. Rankings break
 * ties by zone or tracking id so results do not depend on input order.
 */
@ApplicationScoped
public class SafetyKpiAggregator {

    static final String UNKNOWN_ZONE = "unknown";
    static final int REPEAT_MIN_EVENTS = 2;
    static final int ALL_OFFENDER_LIMIT = 20;
    static final int TYPE_OFFENDER_LIMIT = 10;

    private static final Comparator<RepeatOffenderDTO> OFFENDER_ORDER =
            Comparator.comparingLong(RepeatOffenderDTO::totalEvents)
                    .reversed()
                    .thenComparing(RepeatOffenderDTO::id)
                    .thenComparing(RepeatOffenderDTO::type);

    /**
     * Headline counts, vest compliance and mean overspeed excess.
     *
     * @param humanObservations number of human observations the vest check ran over
     */
    public SafetyTopCardsDTO topCards(
            List<VestViolationDTO> vestViolations,
            List<OverspeedEventDTO> overspeedEvents,
            long humanObservations) {

        double compliance =
                humanObservations > 0
                        ? round((1.0 - (double) vestViolations.size() / humanObservations) * 100.0, 1)
                        : 100.0;

        double avgExcess =
                overspeedEvents.isEmpty()
                        ? 0.0
                        : round(
                                overspeedEvents.stream()
                                        .mapToDouble(OverspeedEventDTO::speedExcess)
                                        .average()
                                        .orElse(0.0),
                                2);

        return new SafetyTopCardsDTO(
                vestViolations.size(),
                uniqueHumans(vestViolations),
                overspeedEvents.size(),
                uniqueVehicles(overspeedEvents),
                compliance,
                avgExcess);
    }

    public long uniqueHumans(List<VestViolationDTO> vestViolations) {
        return vestViolations.stream().map(VestViolationDTO::trackingId).distinct().count();
    }

    /** Distinct overspeeding trajectories, humans excluded. */
    public long uniqueVehicles(List<OverspeedEventDTO> overspeedEvents) {
        return overspeedEvents.stream()
                .filter(e -> e.objectClass() != ObjectClass.HUMAN)
                .map(OverspeedEventDTO::trackingId)
                .distinct()
                .count();
    }

    /**
     * Counts per UTC hour, ascending. Hours without any violation are omitted.
     */
    public List<SafetyTimeSeriesPointDTO> timeSeries(
            List<VestViolationDTO> vestViolations, List<OverspeedEventDTO> overspeedEvents) {
        Map<Instant, long[]> perHour = new TreeMap<>();
        for (VestViolationDTO violation : vestViolations) {
            perHour.computeIfAbsent(hourOf(violation.timestamp()), h -> new long[2])[0]++;
        }
        for (OverspeedEventDTO event : overspeedEvents) {
            perHour.computeIfAbsent(hourOf(event.timestamp()), h -> new long[2])[1]++;
        }

        List<SafetyTimeSeriesPointDTO> series = new ArrayList<>(perHour.size());
        perHour.forEach(
                (hour, counts) -> series.add(new SafetyTimeSeriesPointDTO(hour, counts[0], counts[1])));
        return series;
    }

    /**
     * Violations per zone, with the worst zone for each violation type. Ties for worst
     * zone go to the lexicographically smallest zone id.
     */
    public SafetyZoneAnalysisDTO zoneAnalysis(
            List<VestViolationDTO> vestViolations, List<OverspeedEventDTO> overspeedEvents) {
        if (vestViolations.isEmpty() && overspeedEvents.isEmpty()) {
            return SafetyZoneAnalysisDTO.empty();
        }

        Map<String, Long> vestByZone = new TreeMap<>();
        Map<String, Long> speedByZone = new TreeMap<>();
        for (VestViolationDTO violation : vestViolations) {
            vestByZone.merge(zoneOrUnknown(violation.zone()), 1L, Long::sum);
        }
        for (OverspeedEventDTO event : overspeedEvents) {
            speedByZone.merge(zoneOrUnknown(event.zone()), 1L, Long::sum);
        }

        Map<String, Long> allZones = new TreeMap<>(vestByZone);
        speedByZone.forEach((zone, count) -> allZones.merge(zone, count, Long::sum));

        List<ZoneViolationStatsDTO> byZone = new ArrayList<>(allZones.size());
        allZones.forEach(
                (zone, total) ->
                        byZone.add(
                                new ZoneViolationStatsDTO(
                                        zone,
                                        vestByZone.getOrDefault(zone, 0L),
                                        speedByZone.getOrDefault(zone, 0L),
                                        total)));
        byZone.sort(
                Comparator.comparingLong(ZoneViolationStatsDTO::totalViolations)
                        .reversed()
                        .thenComparing(ZoneViolationStatsDTO::zone));

        return new SafetyZoneAnalysisDTO(List.copyOf(byZone), worstZone(vestByZone), worstZone(speedByZone));
    }

    /**
     * Trajectories with at least {@value #REPEAT_MIN_EVENTS} violations of one type.
     *
     * @param from query window start, may be {@code null}
     * @param to query window end, may be {@code null}
     */
    public RepeatOffendersDTO repeatOffenders(
            List<VestViolationDTO> vestViolations,
            List<OverspeedEventDTO> overspeedEvents,
            Instant from,
            Instant to) {

        double hours =
                from != null && to != null ? Duration.between(from, to).toMillis() / 3_600_000.0 : 0.0;

        List<RepeatOffenderDTO> vestOffenders = new ArrayList<>();
        group(vestViolations, VestViolationDTO::trackingId, null)
                .forEach(
                        (id, stats) -> {
                            if (stats.getCount() >= REPEAT_MIN_EVENTS) {
                                vestOffenders.add(
                                        new RepeatOffenderDTO(
                                                id,
                                                ViolationType.VEST_VIOLATION,
                                                stats.getCount(),
                                                ratePerHour(stats.getCount(), hours),
                                                0.0));
                            }
                        });

        List<RepeatOffenderDTO> speedOffenders = new ArrayList<>();
        group(overspeedEvents, OverspeedEventDTO::trackingId, OverspeedEventDTO::speedExcess)
                .forEach(
                        (id, stats) -> {
                            if (stats.getCount() >= REPEAT_MIN_EVENTS) {
                                speedOffenders.add(
                                        new RepeatOffenderDTO(
                                                id,
                                                ViolationType.OVERSPEED,
                                                stats.getCount(),
                                                ratePerHour(stats.getCount(), hours),
                                                round(stats.getAverage(), 2)));
                            }
                        });

        List<RepeatOffenderDTO> all = new ArrayList<>(vestOffenders);
        all.addAll(speedOffenders);
        all.sort(OFFENDER_ORDER);
        vestOffenders.sort(OFFENDER_ORDER);
        speedOffenders.sort(OFFENDER_ORDER);

        return new RepeatOffendersDTO(
                limit(all, ALL_OFFENDER_LIMIT),
                limit(vestOffenders, TYPE_OFFENDER_LIMIT),
                limit(speedOffenders, TYPE_OFFENDER_LIMIT));
    }

    private static <T> Map<String, DoubleSummaryStatistics> group(
            List<T> items, Function<T, String> key, ToDoubleFunction<T> value) {
        Map<String, DoubleSummaryStatistics> groups = new TreeMap<>();
        for (T item : items) {
            groups.computeIfAbsent(key.apply(item), k -> new DoubleSummaryStatistics())
                    .accept(value != null ? value.applyAsDouble(item) : 0.0);
        }
        return groups;
    }

    /** Events per hour of the window; the plain count when the window is open or empty. */
    private static double ratePerHour(long events, double hours) {
        return hours > 0 ? round(events / hours, 2) : events;
    }

    private static String worstZone(Map<String, Long> countsByZone) {
        String worst = null;
        long worstCount = 0;
        // Ascending iteration with a strict '>' keeps the smallest id on ties.
        for (Map.Entry<String, Long> entry : countsByZone.entrySet()) {
            if (entry.getValue() > worstCount) {
                worstCount = entry.getValue();
                worst = entry.getKey();
            }
        }
        return worst;
    }

    private static String zoneOrUnknown(String zone) {
        return zone == null || zone.isBlank() ? UNKNOWN_ZONE : zone;
    }

    private static Instant hourOf(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.HOURS);
    }

    private static <T> List<T> limit(List<T> items, int max) {
        return items.size() > max ? List.copyOf(items.subList(0, max)) : List.copyOf(items);
    }
}
