package com.ammann.nearmiss.model;

import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.source.TrajectoryQuery;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * Persisted detection row of the trajectory store.
 *
 * <p>Only read by the engine. Rows are written by the external import pipeline.
 */
@Entity
@Table(name = Detection.TABLE_NAME, indexes = {
        @Index(name = "idx_detection_class_ts", columnList = "object_class, timestamp"),
        @Index(name = "idx_detection_zone_ts", columnList = "zone, timestamp"),
        @Index(name = "idx_detection_tracking_id", columnList = "tracking_id")
})
public class Detection extends PanacheEntity
{
    public static final String TABLE_NAME = "detection";

    /**
     * Trajectory identifier from the feed. Not unique across rows.
     */
    @Column(name = "tracking_id", nullable = false, length = 100)
    @NotNull
    public String trackingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "object_class", nullable = false, length = 20)
    @NotNull
    public ObjectClass objectClass;

    /**
     * Detection time (UTC).
     */
    @Column(nullable = false)
    @NotNull
    public Instant timestamp;

    /**
     * Local X coordinate in meters.
     */
    @Column(nullable = false)
    public double x;

    /**
     * Local Y coordinate in meters.
     */
    @Column(nullable = false)
    public double y;

    /**
     * Heading in degrees (0-360), null if unavailable.
     */
    @Column
    public Double heading;

    /**
     * Instantaneous speed in m/s, null if the feed did not report one.
     */
    @Column
    public Double speed;

    /**
     * Safety vest status. Only meaningful for humans.
     */
    @Column
    public Boolean vest;

    @Column(length = 50)
    public String zone;

    public Detection()
    {
    }

    public Detection(String trackingId, ObjectClass objectClass, Instant timestamp, double x, double y)
    {
        this.trackingId = trackingId;
        this.objectClass = objectClass;
        this.timestamp = timestamp;
        this.x = x;
        this.y = y;
    }

    /**
     * Loads all rows matching the typed query, ordered by timestamp then id.
     */
    public static List<Detection> findMatching(TrajectoryQuery query)
    {
        TrajectoryQuery.PanacheFilter filter = query.toPanacheFilter();
        return find(filter.query(), filter.parameters()).list();
    }

    /**
     * Converts this row to the engine's read-only observation.
     */
    public Observation toObservation()
    {
        return new Observation(id, trackingId, objectClass, timestamp, x, y, heading, speed, vest, zone);
    }

    @Override
    public String toString()
    {
        return objectClass + " (" + trackingId + ") in zone " + zone + " at " + timestamp;
    }
}
