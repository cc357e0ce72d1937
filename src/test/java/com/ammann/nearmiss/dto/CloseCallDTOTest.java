/* (C)2026 */
package com.ammann.nearmiss.dto;

import static com.ammann.nearmiss.support.TestDataFactory.BASE;
import static com.ammann.nearmiss.support.TestDataFactory.closeCall;
import static com.ammann.nearmiss.support.TestDataFactory.human;
import static com.ammann.nearmiss.support.TestDataFactory.vehicle;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.nearmiss.enumeration.Severity;
import com.ammann.nearmiss.model.Observation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

class CloseCallDTOTest {

    private final ObjectMapper mapper =
            new ObjectMapper()
                    .findAndRegisterModules()
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void ofCopiesBothObservations() {
        Observation human = human("h-1", 1_000, 0.0, 0.0, "aisle");
        Observation vehicle = vehicle("v-1", 820, 0.6, 0.8, "dock");

        CloseCallDTO closeCall = CloseCallDTO.of(human, vehicle, 1.0, 2.0, 250L);

        assertThat(closeCall.timestamp()).isEqualTo(human.timestamp());
        assertThat(closeCall.humanObservationId()).isEqualTo(human.id());
        assertThat(closeCall.vehicleObservationId()).isEqualTo(vehicle.id());
        assertThat(closeCall.timeDifferenceMs()).isEqualTo(180L);
        assertThat(closeCall.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(closeCall.distanceThreshold()).isEqualTo(2.0);
        assertThat(closeCall.timeWindowMs()).isEqualTo(250L);
    }

    @Test
    void effectiveZonePrefersVehicleZone() {
        assertThat(closeCall("v-1", 0, 1.0, "dock", "aisle").effectiveZone()).isEqualTo("dock");
        assertThat(closeCall("v-1", 0, 1.0, null, "aisle").effectiveZone()).isEqualTo("aisle");
        assertThat(closeCall("v-1", 0, 1.0, " ", "aisle").effectiveZone()).isEqualTo("aisle");
        assertThat(closeCall("v-1", 0, 1.0, null, null).effectiveZone()).isNull();
    }

    @Test
    void minuteBucketTruncatesHumanTimestamp() {
        assertThat(closeCall("v-1", 59_999, 1.0).minuteBucket()).isEqualTo(BASE);
        assertThat(closeCall("v-1", 61_000, 1.0).minuteBucket()).isEqualTo(BASE.plusSeconds(60));
    }

    @Test
    void serializesWithSnakeCaseKeys() throws Exception {
        CloseCallDTO closeCall = closeCall("v-1", 0, 0.5, "dock", null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(closeCall));

        assertThat(json.get("vehicle_tracking_id").asText()).isEqualTo("v-1");
        assertThat(json.get("vehicle_class").asText()).isEqualTo("vehicle");
        assertThat(json.get("vehicle_zone").asText()).isEqualTo("dock");
        assertThat(json.get("severity").asText()).isEqualTo("HIGH");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-04T08:00:00Z");
        assertThat(json.get("time_difference_ms").asLong()).isZero();
        assertThat(json.has("human_zone")).isFalse();
        assertThat(json.has("minute_bucket")).isFalse();
        assertThat(json.has("minuteBucket")).isFalse();
        assertThat(json.has("effectiveZone")).isFalse();
    }

    @Test
    void severityAnalysisSerializesTierNames() throws Exception {
        SeverityAnalysisDTO analysis =
                new SeverityAnalysisDTO(
                        new SeverityStatsDTO(2, 66.7, 0.45),
                        SeverityStatsDTO.EMPTY,
                        new SeverityStatsDTO(1, 33.3, 1.8));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(analysis));

        assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder("HIGH", "MEDIUM", "LOW");
        assertThat(json.get("HIGH").get("avg_distance").asDouble()).isEqualTo(0.45);
        assertThat(analysis.get(Severity.LOW).count()).isEqualTo(1);
        assertThat(analysis.get(Severity.MEDIUM)).isEqualTo(SeverityStatsDTO.EMPTY);
    }
}
