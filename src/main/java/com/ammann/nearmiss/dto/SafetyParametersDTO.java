/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Effective parameters of a safety violation computation, after defaults were applied.
 */
public record SafetyParametersDTO(
        @JsonProperty("from_time") Instant fromTime,
        @JsonProperty("to_time") Instant toTime,
        @JsonProperty("zone") String zone,
        @JsonProperty("speed_threshold") double speedThreshold,
        @JsonProperty("include_humans_in_speed") boolean includeHumansInSpeed,
        @JsonProperty("include_details") boolean includeDetails) {}
