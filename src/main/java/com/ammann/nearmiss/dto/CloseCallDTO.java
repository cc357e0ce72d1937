/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.enumeration.Severity;
import com.ammann.nearmiss.model.Observation;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * A close call: one human observation and one vehicle observation that were within both
 * the spatial and the temporal threshold of each other.
 *
 * <p>Created per computation and never persisted by the engine.
 *
 * @param timestamp timestamp of the human observation
 * @param humanObservationId id of the human observation
 * @param humanTrackingId trajectory of the human
 * @param humanZone zone of the human observation, may be {@code null}
 * @param vehicleObservationId id of the vehicle observation
 * @param vehicleTrackingId trajectory of the vehicle
 * @param vehicleClass class of the vehicle
 * @param vehicleZone zone of the vehicle observation, may be {@code null}
 * @param distance Euclidean separation in meters (full precision)
 * @param distanceThreshold spatial threshold used for matching
 * @param timeWindowMs temporal threshold used for matching
 * @param timeDifferenceMs absolute timestamp difference in milliseconds
 * @param severity severity tier derived from {@code distance}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CloseCallDTO(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("human_observation_id") Long humanObservationId,
        @JsonProperty("human_tracking_id") String humanTrackingId,
        @JsonProperty("human_zone") String humanZone,
        @JsonProperty("vehicle_observation_id") Long vehicleObservationId,
        @JsonProperty("vehicle_tracking_id") String vehicleTrackingId,
        @JsonProperty("vehicle_class") ObjectClass vehicleClass,
        @JsonProperty("vehicle_zone") String vehicleZone,
        @JsonProperty("distance") double distance,
        @JsonProperty("distance_threshold") double distanceThreshold,
        @JsonProperty("time_window_ms") long timeWindowMs,
        @JsonProperty("time_difference_ms") long timeDifferenceMs,
        @JsonProperty("severity") Severity severity) {

    /**
     * Builds the close-call record for an accepted pair.
     *
     * @param human human observation
     * @param vehicle vehicle observation
     * @param distance separation in meters
     * @param distanceThreshold spatial threshold used
     * @param timeWindowMs temporal threshold used
     * @return populated record with severity classified from {@code distance}
     */
    public static CloseCallDTO of(
            Observation human,
            Observation vehicle,
            double distance,
            double distanceThreshold,
            long timeWindowMs) {
        return new CloseCallDTO(
                human.timestamp(),
                human.id(),
                human.trackingId(),
                human.zone(),
                vehicle.id(),
                vehicle.trackingId(),
                vehicle.objectClass(),
                vehicle.zone(),
                distance,
                distanceThreshold,
                timeWindowMs,
                Math.abs(vehicle.timestampMs() - human.timestampMs()),
                Severity.fromDistance(distance));
    }

    /** Human timestamp truncated to the minute (UTC). */
    @JsonIgnore
    public Instant minuteBucket() {
        return timestamp.truncatedTo(ChronoUnit.MINUTES);
    }

    /** Vehicle zone if present, else the human zone; {@code null} when neither is known. */
    @JsonIgnore
    public String effectiveZone() {
        if (vehicleZone != null && !vehicleZone.isBlank()) {
            return vehicleZone;
        }
        return humanZone != null && !humanZone.isBlank() ? humanZone : null;
    }
}
