/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Violation counts for one UTC hour.
 */
public record SafetyTimeSeriesPointDTO(
        @JsonProperty("hour") Instant hour,
        @JsonProperty("vest_violations") long vestViolations,
        @JsonProperty("overspeed_events") long overspeedEvents) {}
