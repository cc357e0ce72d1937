/* (C)2026 */
package com.ammann.nearmiss.support;

import com.ammann.nearmiss.dto.CloseCallDTO;
import com.ammann.nearmiss.dto.OverspeedEventDTO;
import com.ammann.nearmiss.dto.VestViolationDTO;
import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.model.Observation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

public final class TestDataFactory {

    public static final Instant BASE = Instant.parse("2024-03-04T08:00:00Z");

    private static final AtomicLong IDS = new AtomicLong(1);

    private TestDataFactory() {}

    public static Observation human(String trackingId, long offsetMs, double x, double y) {
        return human(trackingId, offsetMs, x, y, null);
    }

    public static Observation human(
            String trackingId, long offsetMs, double x, double y, String zone) {
        return observation(trackingId, ObjectClass.HUMAN, offsetMs, x, y, zone);
    }

    public static Observation vehicle(String trackingId, long offsetMs, double x, double y) {
        return vehicle(trackingId, offsetMs, x, y, null);
    }

    public static Observation vehicle(
            String trackingId, long offsetMs, double x, double y, String zone) {
        return observation(trackingId, ObjectClass.VEHICLE, offsetMs, x, y, zone);
    }

    public static Observation observation(
            String trackingId, ObjectClass objectClass, long offsetMs, double x, double y, String zone) {
        return new Observation(
                IDS.getAndIncrement(),
                trackingId,
                objectClass,
                BASE.plusMillis(offsetMs),
                x,
                y,
                null,
                null,
                objectClass == ObjectClass.HUMAN ? Boolean.TRUE : null,
                zone);
    }

    /** Copy of the reading with a raw speed. */
    public static Observation withSpeed(Observation o, Double speed) {
        return new Observation(
                o.id(), o.trackingId(), o.objectClass(), o.timestamp(), o.x(), o.y(), o.heading(),
                speed, o.vest(), o.zone());
    }

    /** Copy of the reading with a vest state. */
    public static Observation withVest(Observation o, Boolean vest) {
        return new Observation(
                o.id(), o.trackingId(), o.objectClass(), o.timestamp(), o.x(), o.y(), o.heading(),
                o.speed(), vest, o.zone());
    }

    public static VestViolationDTO vestViolation(String trackingId, long offsetMs, String zone) {
        return VestViolationDTO.of(withVest(human(trackingId, offsetMs, 0.0, 0.0, zone), false));
    }

    public static OverspeedEventDTO overspeed(
            String trackingId, ObjectClass objectClass, long offsetMs, double speed, String zone) {
        Observation reading =
                withSpeed(observation(trackingId, objectClass, offsetMs, 0.0, 0.0, zone), speed);
        return OverspeedEventDTO.of(reading, speed, 1.5);
    }

    /**
     * Close call with the given vehicle, human timestamp offset, distance and zones.
     */
    public static CloseCallDTO closeCall(
            String vehicleId, long offsetMs, double distance, String vehicleZone, String humanZone) {
        Observation human = human("h-1", offsetMs, 0.0, 0.0, humanZone);
        Observation vehicle = vehicle(vehicleId, offsetMs, distance, 0.0, vehicleZone);
        return CloseCallDTO.of(human, vehicle, distance, 2.0, 250L);
    }

    public static CloseCallDTO closeCall(String vehicleId, long offsetMs, double distance) {
        return closeCall(vehicleId, offsetMs, distance, null, null);
    }

    /**
     * Random observations of one class on a small site, ascending by timestamp.
     */
    public static List<Observation> randomStream(
            Random random, ObjectClass objectClass, int count, int trajectories, long spanMs) {
        List<Observation> rows = new ArrayList<>(count);
        long[] offsets = random.longs(count, 0, spanMs).sorted().toArray();
        for (long offset : offsets) {
            rows.add(
                    observation(
                            objectClass.getCode() + "-" + random.nextInt(trajectories),
                            objectClass,
                            offset,
                            random.nextDouble() * 10.0,
                            random.nextDouble() * 10.0,
                            "zone-" + random.nextInt(3)));
        }
        return rows;
    }
}
