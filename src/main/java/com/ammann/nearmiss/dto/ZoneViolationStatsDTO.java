/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ZoneViolationStatsDTO(
        @JsonProperty("zone") String zone,
        @JsonProperty("vest_violations") long vestViolations,
        @JsonProperty("overspeed_events") long overspeedEvents,
        @JsonProperty("total_violations") long totalViolations) {}
