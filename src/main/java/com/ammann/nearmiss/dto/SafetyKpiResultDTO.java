/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Result of a safety violation computation: vest violations and overspeed events with
 * their KPIs.
 */
public record SafetyKpiResultDTO(
        @JsonProperty("top_cards") SafetyTopCardsDTO topCards,
        @JsonProperty("vest_violations") List<VestViolationDTO> vestViolations,
        @JsonProperty("overspeed_events") List<OverspeedEventDTO> overspeedEvents,
        @JsonProperty("time_series") List<SafetyTimeSeriesPointDTO> timeSeries,
        @JsonProperty("zone_analysis") SafetyZoneAnalysisDTO zoneAnalysis,
        @JsonProperty("repeat_offenders") RepeatOffendersDTO repeatOffenders,
        @JsonProperty("statistics") SafetyStatisticsDTO statistics,
        @JsonProperty("parameters_used") SafetyParametersDTO parametersUsed,
        @JsonProperty("computed_at") Instant computedAt) {}
