/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Work counters for one computation.
 */
public record ComputationStatisticsDTO(
        @JsonProperty("human_detections_processed") long humanDetectionsProcessed,
        @JsonProperty("vehicle_detections_processed") long vehicleDetectionsProcessed,
        @JsonProperty("close_calls_detected") long closeCallsDetected,
        @JsonProperty("computation_time_ms") double computationTimeMs) {}
