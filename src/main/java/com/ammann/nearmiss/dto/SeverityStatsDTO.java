/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Close-call summary for one severity tier.
 *
 * @param count close calls in the tier
 * @param percentage share of all close calls, rounded to 1 decimal (0 when there are none)
 * @param avgDistance mean distance within the tier, rounded to 2 decimals
 */
public record SeverityStatsDTO(
        @JsonProperty("count") long count,
        @JsonProperty("percentage") double percentage,
        @JsonProperty("avg_distance") double avgDistance) {

    public static final SeverityStatsDTO EMPTY = new SeverityStatsDTO(0L, 0.0, 0.0);
}
