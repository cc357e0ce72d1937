/* (C)2026 */
package com.ammann.nearmiss.service;

import com.ammann.nearmiss.model.Observation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Estimates speed from trajectory geometry when the feed reports none.
 *
 * <p>The derived speed of a trajectory is the arithmetic mean of the finite-difference
 * speeds {@code distance(p[i-1], p[i]) / dt} over consecutive readings. Pairs with a
 * non-positive time delta (duplicate or out-of-order timestamps) are skipped. A trajectory
 * with fewer than two usable readings has a derived speed of {@code 0.0}.
 */
@ApplicationScoped
public class DerivedSpeedService {

    private static final Logger LOG = Logger.getLogger(DerivedSpeedService.class);

    private static final Comparator<Observation> TRAJECTORY_ORDER =
            Comparator.comparing(Observation::trackingId)
                    .thenComparing(Observation::timestamp)
                    .thenComparing(Observation::id, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Derived speed of one trajectory.
     *
     * @param trajectory readings of a single tracking id, ascending by timestamp
     * @return mean pairwise speed in m/s, or {@code 0.0} without a usable pair
     */
    public double deriveSpeed(List<Observation> trajectory) {
        SpeedAccumulator accumulator = new SpeedAccumulator();
        for (Observation observation : trajectory) {
            accumulator.accept(observation);
        }
        return accumulator.mean();
    }

    /**
     * Derived speed of many trajectories in a single pass.
     *
     * <p>Rows are ordered by tracking id then timestamp and the accumulator is reset at each
     * id boundary, so each value equals {@link #deriveSpeed(List)} on that id's readings.
     *
     * @param rows readings of any number of trajectories, in any order
     * @return derived speed per tracking id, in tracking id order
     */
    public Map<String, Double> deriveSpeeds(List<Observation> rows) {
        List<Observation> sorted = new ArrayList<>(rows);
        sorted.sort(TRAJECTORY_ORDER);

        Map<String, Double> speeds = new LinkedHashMap<>();
        String currentId = null;
        SpeedAccumulator accumulator = new SpeedAccumulator();

        for (Observation observation : sorted) {
            if (!observation.trackingId().equals(currentId)) {
                if (currentId != null) {
                    speeds.put(currentId, accumulator.mean());
                }
                currentId = observation.trackingId();
                accumulator = new SpeedAccumulator();
            }
            accumulator.accept(observation);
        }
        if (currentId != null) {
            speeds.put(currentId, accumulator.mean());
        }

        LOG.debugf("Derived speeds for %d trajectories from %d rows", speeds.size(), rows.size());
        return speeds;
    }

    /**
     * The observation's own speed when the feed reported a non-zero value, else the derived
     * speed of its trajectory.
     *
     * @param observation reading whose speed is needed
     * @param derivedSpeeds derived speed per tracking id, as returned by
     *     {@link #deriveSpeeds(List)}; a missing id counts as {@code 0.0}
     * @return speed in m/s
     */
    public double resolveSpeed(Observation observation, Map<String, Double> derivedSpeeds) {
        if (observation.hasSpeed()) {
            return observation.speed();
        }
        return derivedSpeeds.getOrDefault(observation.trackingId(), 0.0);
    }

    /**
     * Running mean of finite-difference speeds over consecutive readings.
     */
    private static final class SpeedAccumulator {
        private Observation previous;
        private double speedSum;
        private int pairs;

        void accept(Observation current) {
            if (previous != null) {
                double dtSeconds = (current.timestampMs() - previous.timestampMs()) / 1000.0;
                if (dtSeconds > 0) {
                    speedSum += previous.distanceTo(current) / dtSeconds;
                    pairs++;
                }
            }
            previous = current;
        }

        double mean() {
            return pairs > 0 ? speedSum / pairs : 0.0;
        }
    }
}
