/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.ammann.nearmiss.enumeration.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Severity distribution of the close calls. Every tier is always present.
 */
public record SeverityAnalysisDTO(
        @JsonProperty("HIGH") SeverityStatsDTO high,
        @JsonProperty("MEDIUM") SeverityStatsDTO medium,
        @JsonProperty("LOW") SeverityStatsDTO low) {

    public static SeverityAnalysisDTO empty() {
        return new SeverityAnalysisDTO(
                SeverityStatsDTO.EMPTY, SeverityStatsDTO.EMPTY, SeverityStatsDTO.EMPTY);
    }

    public SeverityStatsDTO get(Severity severity) {
        return switch (severity) {
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
        };
    }
}
