/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.ammann.nearmiss.enumeration.ObjectClass;
import com.ammann.nearmiss.model.Observation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * An observation whose effective speed exceeded the speed threshold.
 *
 * @param speed raw speed reported by the feed, {@code null} when absent
 * @param derivedSpeed trajectory-derived speed, set only when the raw speed was unusable
 * @param effectiveSpeed the speed that was compared with the threshold
 * @param speedExcess {@code effectiveSpeed - speedThreshold}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OverspeedEventDTO(
        @JsonProperty("id") Long id,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("tracking_id") String trackingId,
        @JsonProperty("object_class") ObjectClass objectClass,
        @JsonProperty("speed") Double speed,
        @JsonProperty("derived_speed") Double derivedSpeed,
        @JsonProperty("effective_speed") double effectiveSpeed,
        @JsonProperty("speed_threshold") double speedThreshold,
        @JsonProperty("speed_excess") double speedExcess,
        @JsonProperty("x") double x,
        @JsonProperty("y") double y,
        @JsonProperty("zone") String zone) {

    public static OverspeedEventDTO of(
            Observation observation, double effectiveSpeed, double speedThreshold) {
        return new OverspeedEventDTO(
                observation.id(),
                observation.timestamp(),
                observation.trackingId(),
                observation.objectClass(),
                observation.speed(),
                observation.hasSpeed() ? null : effectiveSpeed,
                effectiveSpeed,
                speedThreshold,
                effectiveSpeed - speedThreshold,
                observation.x(),
                observation.y(),
                observation.zone());
    }
}
