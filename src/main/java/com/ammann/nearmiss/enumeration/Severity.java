package com.ammann.nearmiss.enumeration;

/**
 * Severity tier of a close call, derived from the separation distance alone.
 *
 * <p>Tier boundaries are absolute meters and do not depend on the distance threshold
 * used for matching. A threshold below 1.0 m therefore yields only {@link #HIGH} matches.
 */
public enum Severity
{
    /** Closer than 1.0 m. */
    HIGH(1.0),
    /** At least 1.0 m and closer than 1.5 m. */
    MEDIUM(1.5),
    /** 1.5 m or more. */
    LOW(Double.POSITIVE_INFINITY);

    private final double upperBoundMeters;

    Severity(double upperBoundMeters) {
        this.upperBoundMeters = upperBoundMeters;
    }

    /**
     * Classifies a separation distance.
     *
     * @param distance Euclidean distance in meters
     * @return the tier whose exclusive upper bound the distance falls under
     */
    public static Severity fromDistance(double distance) {
        if (distance < HIGH.upperBoundMeters) return HIGH;
        if (distance < MEDIUM.upperBoundMeters) return MEDIUM;
        return LOW;
    }

    public double getUpperBoundMeters() { return upperBoundMeters; }
}
