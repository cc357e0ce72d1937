package com.ammann.nearmiss.enumeration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectClassTest
{

    @ParameterizedTest
    @CsvSource({
            "human,HUMAN",
            "vehicle,VEHICLE",
            "pallet_truck,PALLET_TRUCK",
            "PALLET_TRUCK,PALLET_TRUCK",
            "' agv ',AGV"
    })
    void resolvesFeedCodes(String code, ObjectClass expected)
    {
        assertThat(ObjectClass.fromCode(code)).isEqualTo(expected);
    }

    @Test
    void onlyNonHumansAreVehicles()
    {
        assertThat(ObjectClass.HUMAN.isVehicle()).isFalse();
        assertThat(ObjectClass.vehicleClasses())
                .containsExactlyInAnyOrder(ObjectClass.VEHICLE, ObjectClass.PALLET_TRUCK, ObjectClass.AGV);
    }

    @Test
    void rejectsUnknownCodes()
    {
        assertThatThrownBy(() -> ObjectClass.fromCode("forklift"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("forklift");
        assertThatThrownBy(() -> ObjectClass.fromCode(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
