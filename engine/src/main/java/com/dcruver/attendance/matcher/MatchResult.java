package com.dcruver.attendance.matcher;

import lombok.Value;

/**
 * Outcome of matching one embedding against the gallery.
 * Confidence is {@code 1 - distance} and is reported for unknown faces too.
 */
@Value
public class MatchResult {
    public static final String UNKNOWN = "Unknown";

    String label;
    double confidence;
    double distance;  // NaN when the gallery was empty

    public static MatchResult known(String label, double distance) {
        return new MatchResult(label, 1.0 - distance, distance);
    }

    public static MatchResult unknown(double distance) {
        return new MatchResult(UNKNOWN, 1.0 - distance, distance);
    }

    public static MatchResult emptyGallery() {
        return new MatchResult(UNKNOWN, 0.0, Double.NaN);
    }

    public boolean isKnown() {
        return !UNKNOWN.equals(label);
    }
}
