/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Per-zone close-call risk summary.
 *
 * <p>{@code worstZone} is the zone with the most close calls; ties go to the
 * lexicographically smallest zone id. It is {@code null} only when no close call
 * carries a zone. {@code byZone} iterates in zone id order.
 *
 * @param worstZone riskiest zone, or {@code null}
 * @param byZone statistics per zone id
 */
public record ZoneAnalysisDTO(
        @JsonProperty("worst_zone") String worstZone,
        @JsonProperty("by_zone") Map<String, ZoneStatsDTO> byZone) {

    public static ZoneAnalysisDTO empty() {
        return new ZoneAnalysisDTO(null, Map.of());
    }
}
