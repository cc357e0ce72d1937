/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Processing statistics of one safety violation computation.
 */
public record SafetyStatisticsDTO(
        @JsonProperty("human_detections_processed") long humanDetectionsProcessed,
        @JsonProperty("speed_detections_processed") long speedDetectionsProcessed,
        @JsonProperty("vest_violations_detected") long vestViolationsDetected,
        @JsonProperty("overspeed_events_detected") long overspeedEventsDetected,
        @JsonProperty("unique_humans_with_violations") long uniqueHumansWithViolations,
        @JsonProperty("unique_vehicles_overspeeding") long uniqueVehiclesOverspeeding,
        @JsonProperty("computation_time_ms") double computationTimeMs) {}
