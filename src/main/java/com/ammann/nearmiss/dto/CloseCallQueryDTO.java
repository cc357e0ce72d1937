/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.ammann.nearmiss.enumeration.ObjectClass;
import java.time.Instant;

/**
 * Caller-supplied parameters for a close-call computation.
 *
 * <p>Every field is optional. Unset numeric parameters take their configured defaults;
 * unset filters widen the query. Values are validated by
 * {@link com.ammann.nearmiss.service.CloseCallKpiService} before any work begins.
 */
public class CloseCallQueryDTO {

    /** Maximum separation in meters (must be positive). */
    public Double distanceThreshold;

    /** Maximum timestamp difference in milliseconds (must be non-negative). */
    public Long timeWindowMs;

    /** Inclusive start of the human observation window. */
    public Instant fromTime;

    /** Exclusive end of the human observation window. */
    public Instant toTime;

    public String zone;

    /** Restricts vehicles to a single vehicle class. */
    public ObjectClass vehicleClass;

    /** Human observations per matching batch (must be positive). */
    public Integer batchSize;

    /** When {@code false}, only close calls and the time series are computed. */
    public Boolean includeKpis;

    /** When {@code false}, the close-call list is omitted from the result. */
    public Boolean includeDetails;

    public CloseCallQueryDTO distanceThreshold(double value) {
        this.distanceThreshold = value;
        return this;
    }

    public CloseCallQueryDTO timeWindowMs(long value) {
        this.timeWindowMs = value;
        return this;
    }

    public CloseCallQueryDTO between(Instant from, Instant to) {
        this.fromTime = from;
        this.toTime = to;
        return this;
    }

    public CloseCallQueryDTO zone(String value) {
        this.zone = value;
        return this;
    }

    public CloseCallQueryDTO vehicleClass(ObjectClass value) {
        this.vehicleClass = value;
        return this;
    }

    public CloseCallQueryDTO batchSize(int value) {
        this.batchSize = value;
        return this;
    }

    public CloseCallQueryDTO includeKpis(boolean value) {
        this.includeKpis = value;
        return this;
    }

    public CloseCallQueryDTO includeDetails(boolean value) {
        this.includeDetails = value;
        return this;
    }

    @Override
    public String toString() {
        return "CloseCallQueryDTO{"
                + "distanceThreshold="
                + distanceThreshold
                + ", timeWindowMs="
                + timeWindowMs
                + ", fromTime="
                + fromTime
                + ", toTime="
                + toTime
                + ", zone='"
                + zone
                + '\''
                + ", vehicleClass="
                + vehicleClass
                + ", batchSize="
                + batchSize
                + '}';
    }
}
