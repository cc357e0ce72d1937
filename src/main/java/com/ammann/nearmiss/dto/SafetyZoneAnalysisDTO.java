/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Violations per zone. Observations without a zone are counted under {@code "unknown"}.
 *
 * @param byZone zones descending by total violations, ties by zone id
 * @param worstZoneVest zone with the most vest violations, or {@code null}
 * @param worstZoneSpeed zone with the most overspeed events, or {@code null}
 */
public record SafetyZoneAnalysisDTO(
        @JsonProperty("by_zone") List<ZoneViolationStatsDTO> byZone,
        @JsonProperty("worst_zone_vest") String worstZoneVest,
        @JsonProperty("worst_zone_speed") String worstZoneSpeed) {

    public static SafetyZoneAnalysisDTO empty() {
        return new SafetyZoneAnalysisDTO(List.of(), null, null);
    }
}
