package com.star.loginsight.model;

/**
 * Ordered from weakest to strongest.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    public static Confidence min(Confidence a, Confidence b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
