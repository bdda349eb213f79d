package com.star.loginsight.model;

/**
 * The bucket value a baseline describes.
 */
public enum MetricKind {
    /** Raw event count per window. */
    COUNT,
    /** Fraction of the service's (or window's) events, e.g. an error rate. */
    RATIO,
    /** Events per second. */
    RATE
}
