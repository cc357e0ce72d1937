/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Close-call count and distance summary for one zone. Distances are rounded to 2 decimals.
 */
public record ZoneStatsDTO(
        @JsonProperty("close_calls") long closeCalls,
        @JsonProperty("avg_distance") double avgDistance,
        @JsonProperty("min_distance") double minDistance,
        @JsonProperty("max_distance") double maxDistance) {}
