package com.star.loginsight.model;

import com.star.loginsight.exception.ConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Detection thresholds. {@code medium} and {@code high} are deviation scores,
 * {@code epsilon} guards against zero variability and {@code evidenceCap} bounds
 * the evidence carried by each anomaly.
 */
@Value
@Builder(toBuilder = true)
public class ThresholdConfig {

    public static final ThresholdConfig DEFAULTS = ThresholdConfig.builder().build();

    @Builder.Default
    double medium = 2.0;

    @Builder.Default
    double high = 3.0;

    @Builder.Default
    double epsilon = 1e-6;

    @Builder.Default
    int evidenceCap = 5;

    /**
     * @throws ConfigException naming the offending field
     */
    public ThresholdConfig validate() {
        if (!(medium > 0) || Double.isInfinite(medium)) {
            throw ConfigException.invalidField("thresholds.medium", medium, "must be a positive number");
        }
        if (!(high >= medium) || Double.isInfinite(high)) {
            throw ConfigException.invalidField("thresholds.high", high, "must be a number no smaller than medium");
        }
        if (!(epsilon > 0)) {
            throw ConfigException.invalidField("thresholds.epsilon", epsilon, "must be positive");
        }
        if (evidenceCap < 1) {
            throw ConfigException.invalidField("thresholds.evidence-cap", evidenceCap, "must be at least 1");
        }
        return this;
    }
}
