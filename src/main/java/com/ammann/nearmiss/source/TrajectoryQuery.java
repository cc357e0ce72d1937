/* (C)2026 */
package com.ammann.nearmiss.source;

import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.model.Observation;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed predicate passed to a {@link TrajectorySource}.
 *
 * <p>Supports filtering by:
 * <ul>
 *   <li>objectClasses - class membership (required, non-empty)</li>
 *   <li>from - inclusive lower time bound</li>
 *   <li>to - upper time bound, exclusive unless {@code toInclusive}</li>
 *   <li>zone - exact zone match</li>
 *   <li>trackingId - exact trajectory match</li>
 * </ul>
 * A {@code null} bound or filter widens the query.
 *
 * @param objectClasses classes to include
 * @param from inclusive lower bound, or {@code null}
 * @param to upper bound, or {@code null}
 * @param toInclusive whether {@code to} itself is included
 * @param zone zone identifier, or {@code null}
 * @param trackingId trajectory identifier, or {@code null}
 */
public record TrajectoryQuery(
        Set<ObjectClass> objectClasses,
        Instant from,
        Instant to,
        boolean toInclusive,
        String zone,
        String trackingId) {

    public TrajectoryQuery {
        Objects.requireNonNull(objectClasses, "objectClasses");
        if (objectClasses.isEmpty()) {
            throw new IllegalArgumentException("At least one object class is required");
        }
        objectClasses = Collections.unmodifiableSet(EnumSet.copyOf(objectClasses));
        zone = blankToNull(zone);
        trackingId = blankToNull(trackingId);
    }

    /**
     * Human observations in the half-open window {@code [from, to)}.
     */
    public static TrajectoryQuery humans(Instant from, Instant to, String zone) {
        return new TrajectoryQuery(EnumSet.of(ObjectClass.HUMAN), from, to, false, zone, null);
    }

    /**
     * Observations of the given classes in the half-open window {@code [from, to)}.
     */
    public static TrajectoryQuery of(
            Set<ObjectClass> objectClasses, Instant from, Instant to, String zone) {
        return new TrajectoryQuery(objectClasses, from, to, false, zone, null);
    }

    /**
     * Vehicle observations in the closed window {@code [from, to]}, optionally narrowed
     * to a single vehicle class.
     */
    public static TrajectoryQuery vehicles(
            Instant from, Instant to, String zone, ObjectClass vehicleClass) {
        Set<ObjectClass> classes =
                vehicleClass != null ? EnumSet.of(vehicleClass) : ObjectClass.vehicleClasses();
        return new TrajectoryQuery(classes, from, to, true, zone, null);
    }

    /**
     * All readings of one trajectory in the half-open window {@code [from, to)}.
     */
    public static TrajectoryQuery trajectory(String trackingId, Instant from, Instant to) {
        Objects.requireNonNull(trackingId, "trackingId");
        return new TrajectoryQuery(
                EnumSet.allOf(ObjectClass.class), from, to, false, null, trackingId);
    }

    /**
     * Evaluates the predicate against a single observation.
     */
    public boolean matches(Observation observation) {
        if (!objectClasses.contains(observation.objectClass())) {
            return false;
        }
        Instant ts = observation.timestamp();
        if (from != null && ts.isBefore(from)) {
            return false;
        }
        if (to != null) {
            int cmp = ts.compareTo(to);
            if (cmp > 0 || (cmp == 0 && !toInclusive)) {
                return false;
            }
        }
        if (zone != null && !zone.equals(observation.zone())) {
            return false;
        }
        return trackingId == null || trackingId.equals(observation.trackingId());
    }

    /**
     * Builds a parameterized Panache query string with named parameters, ordered by
     * timestamp then id.
     */
    public PanacheFilter toPanacheFilter() {
        StringBuilder queryStr = new StringBuilder("objectClass IN :classes");
        Map<String, Object> params = new HashMap<>();
        params.put("classes", objectClasses);

        if (from != null) {
            queryStr.append(" AND timestamp >= :from");
            params.put("from", from);
        }

        if (to != null) {
            queryStr.append(toInclusive ? " AND timestamp <= :to" : " AND timestamp < :to");
            params.put("to", to);
        }

        if (zone != null) {
            queryStr.append(" AND zone = :zone");
            params.put("zone", zone);
        }

        if (trackingId != null) {
            queryStr.append(" AND trackingId = :trackingId");
            params.put("trackingId", trackingId);
        }

        queryStr.append(" ORDER BY timestamp ASC, id ASC");
        return new PanacheFilter(queryStr.toString(), Collections.unmodifiableMap(params));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * A Panache query string with its named parameters.
     */
    public record PanacheFilter(String query, Map<String, Object> parameters) {}
}
