/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Complete result of one close-call computation. Recomputed per call; every
 * substructure is non-null and zero-valued when there are no close calls.
 */
public record CloseCallKpiResultDTO(
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("close_calls") List<CloseCallDTO> closeCalls,
        @JsonProperty("time_series") List<TimeSeriesPointDTO> timeSeries,
        @JsonProperty("top_offenders") List<TopOffenderDTO> topOffenders,
        @JsonProperty("zone_analysis") ZoneAnalysisDTO zoneAnalysis,
        @JsonProperty("near_miss_rate") NearMissRateDTO nearMissRate,
        @JsonProperty("severity_analysis") SeverityAnalysisDTO severityAnalysis,
        @JsonProperty("statistics") ComputationStatisticsDTO statistics,
        @JsonProperty("parameters_used") CloseCallParametersDTO parametersUsed,
        @JsonProperty("computed_at") Instant computedAt) {}
