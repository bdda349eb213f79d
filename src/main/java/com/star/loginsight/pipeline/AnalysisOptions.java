package com.star.loginsight.pipeline;

import com.star.loginsight.aggregation.Aggregator;
import com.star.loginsight.model.DimensionSpec;
import com.star.loginsight.model.ThresholdConfig;
import com.star.loginsight.parser.DefaultPatternRules;
import com.star.loginsight.parser.PatternRule;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Per-run settings. {@code eventLimit} and {@code timeout} are unbounded when null.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisOptions {

    public static final Duration DEFAULT_WINDOW_SIZE = Duration.ofMinutes(5);

    public static final Duration DEFAULT_CORRELATION_WINDOW = Duration.ofMinutes(5);

    @Builder.Default
    List<PatternRule> rules = DefaultPatternRules.rules();

    @Builder.Default
    Duration windowSize = DEFAULT_WINDOW_SIZE;

    @Builder.Default
    Set<DimensionSpec> dimensions = Aggregator.DEFAULT_DIMENSIONS;

    @Builder.Default
    ThresholdConfig thresholds = ThresholdConfig.DEFAULTS;

    @Builder.Default
    Duration correlationWindow = DEFAULT_CORRELATION_WINDOW;

    Integer eventLimit;

    Duration timeout;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }
}
