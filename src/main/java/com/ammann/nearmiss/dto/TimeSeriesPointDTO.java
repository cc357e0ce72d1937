/* (C)2026 */
package com.ammann.nearmiss.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Number of close calls whose human observation falls into one minute bucket.
 *
 * @param minute bucket start (UTC, truncated to the minute)
 * @param count close calls in the bucket, always positive
 */
public record TimeSeriesPointDTO(
        @JsonProperty("time") Instant minute, @JsonProperty("count") long count) {}
