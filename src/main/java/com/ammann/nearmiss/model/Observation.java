/* (C)2026 */
package com.ammann.nearmiss.model;

import com.ammann.nearmiss.enumeration.ObjectClass;
import java.time.Instant;
import java.util.Objects;

/**
 * One timestamped position reading for a tracked object, as delivered by a
 * {@link com.ammann.nearmiss.source.TrajectorySource}.
 *
 * <p>Coordinates are meters in the site's local frame. {@code heading}, {@code speed},
 * {@code vest} and {@code zone} are optional and may be {@code null}.
 *
 * @param id source row identifier
 * @param trackingId trajectory identifier, shared by all readings of one object
 * @param objectClass classification of the object
 * @param timestamp UTC instant of the reading
 * @param x local X coordinate in meters
 * @param y local Y coordinate in meters
 * @param heading heading in degrees (0-360)
 * @param speed instantaneous speed in m/s
 * @param vest safety vest status, meaningful for humans only
 * @param zone opaque zone identifier
 */
public record Observation(
        Long id,
        String trackingId,
        ObjectClass objectClass,
        Instant timestamp,
        double x,
        double y,
        Double heading,
        Double speed,
        Boolean vest,
        String zone) {

    public Observation {
        Objects.requireNonNull(trackingId, "trackingId");
        Objects.requireNonNull(objectClass, "objectClass");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException(
                    "Observation " + id + " has non-finite coordinates (" + x + ", " + y + ")");
        }
    }

    /** Millisecond epoch of the reading. */
    public long timestampMs() {
        return timestamp.toEpochMilli();
    }

    /** Euclidean distance in meters to another reading. */
    public double distanceTo(Observation other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    /** Returns {@code true} if a usable raw speed reading is present. */
    public boolean hasSpeed() {
        return speed != null && speed != 0.0 && Double.isFinite(speed);
    }
}
