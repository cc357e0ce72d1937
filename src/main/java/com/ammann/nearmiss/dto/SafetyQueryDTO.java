/* (C)2026 */
package com.ammann.nearmiss.dto;

import java.time.Instant;

/**
 * Caller-supplied parameters for a safety violation computation.
 *
 * <p>Every field is optional. An unset speed threshold takes the configured default;
 * unset filters widen the query.
 */
public class SafetyQueryDTO {

    /** Inclusive start of the observation window. */
    public Instant fromTime;

    /** Exclusive end of the observation window. */
    public Instant toTime;

    public String zone;

    /** Speed in m/s above which an observation is an overspeed event (must be >= 0). */
    public Double speedThreshold;

    /** When {@code true}, humans are checked for overspeed as well as vehicles. */
    public Boolean includeHumansInSpeed;

    /** When {@code false}, the violation and event lists are omitted from the result. */
    public Boolean includeDetails;

    public SafetyQueryDTO between(Instant from, Instant to) {
        this.fromTime = from;
        this.toTime = to;
        return this;
    }

    public SafetyQueryDTO zone(String value) {
        this.zone = value;
        return this;
    }

    public SafetyQueryDTO speedThreshold(double value) {
        this.speedThreshold = value;
        return this;
    }

    public SafetyQueryDTO includeHumansInSpeed(boolean value) {
        this.includeHumansInSpeed = value;
        return this;
    }

    public SafetyQueryDTO includeDetails(boolean value) {
        this.includeDetails = value;
        return this;
    }

    @Override
    public String toString() {
        return "SafetyQueryDTO{"
                + "fromTime="
                + fromTime
                + ", toTime="
                + toTime
                + ", zone='"
                + zone
                + '\''
                + ", speedThreshold="
                + speedThreshold
                + ", includeHumansInSpeed="
                + includeHumansInSpeed
                + '}';
    }
}
