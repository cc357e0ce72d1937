/* (C)2026 */
package com.ammann.nearmiss.service;

import com.ammann.nearmiss.model.Observation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable timestamp index over one observation stream.
 *
 * <p>Holds the observations in ascending timestamp order together with a parallel
 * array of millisecond timestamps, so that all observations inside
 * {@code [t - w, t + w]} can be located with two binary searches. Input in any order is
 * accepted; it is stably sorted on build when not already ordered.
 */
public final class TimeWindowIndex {

    private final List<Observation> rows;
    private final long[] timestampsMs;

    private TimeWindowIndex(List<Observation> rows, long[] timestampsMs) {
        this.rows = rows;
        this.timestampsMs = timestampsMs;
    }

    /**
     * Builds the index.
     *
     * @param observations stream to index, in any order
     * @return index over a sorted copy of the stream
     */
    public static TimeWindowIndex build(List<Observation> observations) {
        Objects.requireNonNull(observations, "observations");

        List<Observation> sorted = new ArrayList<>(observations);
        if (!isTimeOrdered(sorted)) {
            sorted.sort(Comparator.comparing(Observation::timestamp));
        }

        long[] timestamps = new long[sorted.size()];
        for (int i = 0; i < timestamps.length; i++) {
            timestamps[i] = sorted.get(i).timestampMs();
        }

        return new TimeWindowIndex(List.copyOf(sorted), timestamps);
    }

    /**
     * Returns the half-open index range of all rows with
     * {@code centerMs - windowMs <= timestamp <= centerMs + windowMs}. Bounds that would
     * overflow are clamped to the {@code long} range.
     *
     * @param centerMs window center in epoch milliseconds
     * @param windowMs half-width of the window, non-negative
     * @return range of matching positions, possibly empty
     */
    public Range range(long centerMs, long windowMs) {
        if (windowMs < 0) {
            throw new IllegalArgumentException("Window must be non-negative: " + windowMs);
        }
        int lo = lowerBound(saturatedSubtract(centerMs, windowMs));
        int hi = upperBound(saturatedAdd(centerMs, windowMs));
        return new Range(lo, Math.max(lo, hi));
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static long saturatedSubtract(long a, long b) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MIN_VALUE;
        }
    }

    public Observation get(int position) {
        return rows.get(position);
    }

    public long timestampMsAt(int position) {
        return timestampsMs[position];
    }

    /** All indexed observations in ascending timestamp order. */
    public List<Observation> rows() {
        return rows;
    }

    public int size() {
        return timestampsMs.length;
    }

    public boolean isEmpty() {
        return timestampsMs.length == 0;
    }

    /** First position whose timestamp is {@code >= key}. */
    private int lowerBound(long key) {
        int lo = 0;
        int hi = timestampsMs.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (timestampsMs[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** First position whose timestamp is {@code > key}. */
    private int upperBound(long key) {
        int lo = 0;
        int hi = timestampsMs.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (timestampsMs[mid] <= key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    static boolean isTimeOrdered(List<Observation> observations) {
        for (int i = 1; i < observations.size(); i++) {
            if (observations.get(i).timestamp().isBefore(observations.get(i - 1).timestamp())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Half-open position range {@code [lo, hi)} into the index.
     */
    public record Range(int lo, int hi) {

        public boolean isEmpty() {
            return lo >= hi;
        }

        public int size() {
            return hi - lo;
        }
    }
}
