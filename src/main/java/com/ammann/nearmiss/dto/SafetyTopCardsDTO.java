/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Headline safety figures.
 *
 * @param vestCompliancePercentage share of human observations with a vest or unknown
 *     vest state, rounded to 1 decimal; 100 when there are no human observations
 * @param avgOverspeedExcess mean speed excess over the threshold, rounded to 2 decimals
 */
public record SafetyTopCardsDTO(
        @JsonProperty("vest_violations_count") long vestViolationsCount,
        @JsonProperty("vest_violations_unique_humans") long vestViolationsUniqueHumans,
        @JsonProperty("overspeed_events_count") long overspeedEventsCount,
        @JsonProperty("overspeed_events_unique_vehicles") long overspeedEventsUniqueVehicles,
        @JsonProperty("vest_compliance_percentage") double vestCompliancePercentage,
        @JsonProperty("avg_overspeed_excess") double avgOverspeedExcess) {}
