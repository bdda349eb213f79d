package com.star.loginsight.model;

import lombok.Builder;
import lombok.Value;

/**
 * Historical expectation for one dimension key.
 */
@Value
@Builder
public class Baseline {

    double expected;

    double variability;

    @Builder.Default
    MetricKind metric = MetricKind.COUNT;

    public static Baseline of(double expected, double variability) {
        return new Baseline(expected, variability, MetricKind.COUNT);
    }

    public static Baseline of(double expected, double variability, MetricKind metric) {
        return new Baseline(expected, variability, metric);
    }
}
