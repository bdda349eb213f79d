package com.star.loginsight.detection;

import com.star.loginsight.model.Anomaly;
import com.star.loginsight.model.AnomalyKind;
import com.star.loginsight.model.Baseline;
import com.star.loginsight.model.Confidence;
import com.star.loginsight.model.DimensionKey;
import com.star.loginsight.model.MetricBucket;
import com.star.loginsight.model.MetricKind;
import com.star.loginsight.model.ParsedEvent;
import com.star.loginsight.model.ThresholdConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Compares current metric buckets against the baseline and emits ranked anomalies.
 *
 * <p>A bucket whose key has no baseline entry yields a low-confidence
 * {@link AnomalyKind#MISSING_BASELINE}; it never raises. A bucket whose key carries
 * a signature the baseline has no history of additionally yields a
 * {@link AnomalyKind#NEW_SIGNATURE}.
 */
@Slf4j
public class AnomalyDetector {

    public List<Anomaly> detect(List<MetricBucket> current, BaselineLookup baseline, ThresholdConfig thresholds) {
        ThresholdConfig limits = (thresholds != null ? thresholds : ThresholdConfig.DEFAULTS).validate();
        if (current == null || current.isEmpty()) {
            return List.of();
        }
        BaselineLookup lookup = baseline != null ? baseline : BaselineLookup.empty();

        List<Anomaly> anomalies = new ArrayList<>();
        int missing = 0;
        for (MetricBucket bucket : current) {
            Optional<Baseline> expected = lookup.get(bucket.getKey());
            if (expected.isEmpty() || !isUsable(expected.get())) {
                anomalies.add(missingBaseline(bucket, limits));
                missing++;
            } else {
                compare(bucket, expected.get(), limits).ifPresent(anomalies::add);
            }
            if (bucket.getKey().hasSignature() && !lookup.knowsSignature(bucket.getKey())) {
                anomalies.add(newSignature(bucket, limits));
            }
        }

        anomalies.sort(Anomaly.RANKING);
        log.debug("Detected {} anomalies across {} buckets ({} without baseline)",
                anomalies.size(), current.size(), missing);
        return Collections.unmodifiableList(anomalies);
    }

    private Optional<Anomaly> compare(MetricBucket bucket, Baseline baseline, ThresholdConfig limits) {
        double observed = bucket.valueOf(baseline.getMetric());
        double deviation = (observed - baseline.getExpected())
                / Math.max(baseline.getVariability(), limits.getEpsilon());

        Confidence confidence;
        if (deviation >= limits.getHigh()) {
            confidence = Confidence.HIGH;
        } else if (deviation >= limits.getMedium()) {
            confidence = Confidence.MEDIUM;
        } else {
            return Optional.empty();
        }

        AnomalyKind kind = baseline.getMetric() == MetricKind.RATE ? AnomalyKind.RATE_INCREASE : AnomalyKind.SPIKE;
        return Optional.of(anomaly(bucket, kind)
                .observedValue(observed)
                .expectedValue(baseline.getExpected())
                .deviationScore(deviation)
                .confidence(confidence)
                .evidence(evidence(bucket, limits.getEvidenceCap()))
                .build());
    }

    private Anomaly missingBaseline(MetricBucket bucket, ThresholdConfig limits) {
        return anomaly(bucket, AnomalyKind.MISSING_BASELINE)
                .observedValue(bucket.getCount())
                .deviationScore(0.0)
                .confidence(Confidence.LOW)
                .evidence(evidence(bucket, limits.getEvidenceCap()))
                .build();
    }

    private Anomaly newSignature(MetricBucket bucket, ThresholdConfig limits) {
        return anomaly(bucket, AnomalyKind.NEW_SIGNATURE)
                .observedValue(bucket.getCount())
                .expectedValue(0.0)
                .deviationScore(limits.getHigh())
                .confidence(Confidence.HIGH)
                .evidence(evidence(bucket, limits.getEvidenceCap()))
                .build();
    }

    private static Anomaly.AnomalyBuilder anomaly(MetricBucket bucket, AnomalyKind kind) {
        DimensionKey key = bucket.getKey();
        return Anomaly.builder()
                .id(Anomaly.idFor(kind, key, bucket.getWindowStart()))
                .key(key)
                .kind(kind)
                .windowStart(bucket.getWindowStart())
                .windowEnd(bucket.getWindowEnd());
    }

    // Bucket events are chronological, so the tail holds the most recent ones.
    private static List<ParsedEvent> evidence(MetricBucket bucket, int cap) {
        List<ParsedEvent> events = bucket.getEvents();
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        List<ParsedEvent> evidence = new ArrayList<>(Math.min(cap, events.size()));
        for (int i = events.size() - 1; i >= 0 && evidence.size() < cap; i--) {
            evidence.add(events.get(i));
        }
        return List.copyOf(evidence);
    }

    private static boolean isUsable(Baseline baseline) {
        return Double.isFinite(baseline.getExpected()) && Double.isFinite(baseline.getVariability());
    }
}
