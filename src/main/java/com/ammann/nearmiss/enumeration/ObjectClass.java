package com.ammann.nearmiss.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Classification of a tracked object as reported by the tracking feed.
 *
 * <p>Everything except {@link #HUMAN} is a vehicle class for close-call purposes.
 */
public enum ObjectClass
{
    HUMAN("human"),
    VEHICLE("vehicle"),
    PALLET_TRUCK("pallet_truck"),
    AGV("agv");

    private static final Set<ObjectClass> VEHICLE_CLASSES = EnumSet.of(VEHICLE, PALLET_TRUCK, AGV);

    private final String code;

    ObjectClass(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }

    public boolean isVehicle() {
        return VEHICLE_CLASSES.contains(this);
    }

    /**
     * Returns the set of all vehicle classes (a fresh, mutable copy).
     */
    public static Set<ObjectClass> vehicleClasses() {
        return EnumSet.copyOf(VEHICLE_CLASSES);
    }

    /**
     * Resolves a feed code ({@code "pallet_truck"}) or enum name ({@code "PALLET_TRUCK"}).
     *
     * @param value code or name, case-insensitive
     * @return the matching class
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static ObjectClass fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Object class must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ObjectClass objectClass : values()) {
            if (objectClass.code.equals(normalized)) {
                return objectClass;
            }
        }
        throw new IllegalArgumentException("Unknown object class: " + value);
    }
}
