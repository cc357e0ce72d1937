/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.ammann.nearmiss.enumeration.ObjectClass;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Effective, validated parameters of a computation after defaults were applied.
 */
public record CloseCallParametersDTO(
        @JsonProperty("distance_threshold") double distanceThreshold,
        @JsonProperty("time_window_ms") long timeWindowMs,
        @JsonProperty("from_time") Instant fromTime,
        @JsonProperty("to_time") Instant toTime,
        @JsonProperty("zone") String zone,
        @JsonProperty("vehicle_class") ObjectClass vehicleClass,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("include_kpis") boolean includeKpis,
        @JsonProperty("include_details") boolean includeDetails) {}
