/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Close calls normalized per 100 vehicle-minutes.
 *
 * @param ratePer100Minutes close calls per 100 vehicle-minutes, rounded to 2 decimals
 * @param totalVehicleMinutes distinct vehicles times observation minutes, rounded to 2 decimals
 * @param uniqueVehicles distinct vehicle tracking ids involved in close calls
 * @param observationMinutes length of the observation window in minutes, rounded to 2 decimals
 */
public record NearMissRateDTO(
        @JsonProperty("rate_per_100_minutes") double ratePer100Minutes,
        @JsonProperty("total_vehicle_minutes") double totalVehicleMinutes,
        @JsonProperty("unique_vehicles") long uniqueVehicles,
        @JsonProperty("observation_minutes") double observationMinutes) {

    public static NearMissRateDTO empty(double observationMinutes) {
        return new NearMissRateDTO(0.0, 0.0, 0L, observationMinutes);
    }
}
