/* (C)2026 */
package com.ammann.nearmiss.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.nearmiss.enumeration.ObjectClass;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ObservationTest {

    private static final Instant TS = Instant.parse("2024-03-04T08:00:00.125Z");

    @Test
    void rejectsNonFiniteCoordinates() {
        assertThatThrownBy(() -> observation(Double.NaN, 0.0, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> observation(0.0, Double.POSITIVE_INFINITY, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exposesMillisecondTimestampAndDistance() {
        Observation a = observation(0.0, 0.0, null);
        Observation b = observation(3.0, 4.0, null);

        assertThat(a.timestampMs()).isEqualTo(TS.toEpochMilli());
        assertThat(a.distanceTo(b)).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void zeroOrMissingSpeedIsNotUsable() {
        assertThat(observation(0, 0, null).hasSpeed()).isFalse();
        assertThat(observation(0, 0, 0.0).hasSpeed()).isFalse();
        assertThat(observation(0, 0, 1.2).hasSpeed()).isTrue();
    }

    @Test
    void detectionMapsToObservation() {
        Detection detection = new Detection("v-7", ObjectClass.AGV, TS, 1.5, -2.0);
        detection.id = 42L;
        detection.speed = 0.8;
        detection.heading = 90.0;
        detection.zone = "dock";

        Observation observation = detection.toObservation();

        assertThat(observation.id()).isEqualTo(42L);
        assertThat(observation.trackingId()).isEqualTo("v-7");
        assertThat(observation.objectClass()).isEqualTo(ObjectClass.AGV);
        assertThat(observation.timestamp()).isEqualTo(TS);
        assertThat(observation.x()).isEqualTo(1.5);
        assertThat(observation.y()).isEqualTo(-2.0);
        assertThat(observation.speed()).isEqualTo(0.8);
        assertThat(observation.heading()).isEqualTo(90.0);
        assertThat(observation.vest()).isNull();
        assertThat(observation.zone()).isEqualTo("dock");
    }

    private static Observation observation(double x, double y, Double speed) {
        return new Observation(1L, "h-1", ObjectClass.HUMAN, TS, x, y, null, speed, true, null);
    }
}
