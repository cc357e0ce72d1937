/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.ammann.nearmiss.enumeration.ViolationType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A trajectory with at least two violations of one type.
 *
 * @param ratePerHour events per hour of the query window, or the event count when the
 *     window is open
 * @param avgExcess mean speed excess for overspeed offenders, 0 for vest offenders
 */
public record RepeatOffenderDTO(
        @JsonProperty("id") String id,
        @JsonProperty("type") ViolationType type,
        @JsonProperty("total_events") long totalEvents,
        @JsonProperty("rate_per_hour") double ratePerHour,
        @JsonProperty("avg_excess") double avgExcess) {}
