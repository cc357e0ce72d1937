/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record RepeatOffendersDTO(
        @JsonProperty("all_offenders") List<RepeatOffenderDTO> allOffenders,
        @JsonProperty("vest_offenders") List<RepeatOffenderDTO> vestOffenders,
        @JsonProperty("speed_offenders") List<RepeatOffenderDTO> speedOffenders) {

    public static RepeatOffendersDTO empty() {
        return new RepeatOffendersDTO(List.of(), List.of(), List.of());
    }
}
