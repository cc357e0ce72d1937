/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Close-call ranking entry for one vehicle trajectory.
 *
 * @param vehicleId vehicle tracking id
 * @param closeCalls number of close calls involving the vehicle
 * @param exposureMinutes distinct minute buckets in which the vehicle had a close call
 * @param ratePerMinute {@code closeCalls / exposureMinutes}, rounded to 3 decimals
 */
public record TopOffenderDTO(
        @JsonProperty("vehicle_id") String vehicleId,
        @JsonProperty("close_calls") long closeCalls,
        @JsonProperty("exposure_minutes") long exposureMinutes,
        @JsonProperty("rate_per_minute") double ratePerMinute) {}
