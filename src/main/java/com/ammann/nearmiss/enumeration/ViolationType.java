package com.ammann.nearmiss.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of safety violation a repeat offender is ranked for.
 */
public enum ViolationType
{
    /** A human observed without a safety vest. */
    VEST_VIOLATION("vest_violation"),
    /** An object moving faster than the speed threshold. */
    OVERSPEED("overspeed");

    private final String code;

    ViolationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }
}
