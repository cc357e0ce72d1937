/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.ammann.nearmiss.model.Observation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A human observation reported without a safety vest.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VestViolationDTO(
        @JsonProperty("id") Long id,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("tracking_id") String trackingId,
        @JsonProperty("x") double x,
        @JsonProperty("y") double y,
        @JsonProperty("zone") String zone) {

    public static VestViolationDTO of(Observation human) {
        return new VestViolationDTO(
                human.id(), human.timestamp(), human.trackingId(), human.x(), human.y(), human.zone());
    }
}
