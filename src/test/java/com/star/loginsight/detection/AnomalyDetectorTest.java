package com.star.loginsight.detection;

import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.model.Anomaly;
import com.star.loginsight.model.AnomalyKind;
import com.star.loginsight.model.Baseline;
import com.star.loginsight.model.Confidence;
import com.star.loginsight.model.DimensionKey;
import com.star.loginsight.model.MetricBucket;
import com.star.loginsight.model.MetricKind;
import com.star.loginsight.model.ParsedEvent;
import com.star.loginsight.model.ThresholdConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.star.loginsight.model.TestEvents.error;
import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");
    private static final DimensionKey AUTH = DimensionKey.service("auth");
    private static final DimensionKey AUTH_DB = DimensionKey.of("auth", (String) null, "DB_TIMEOUT");

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector();
    }

    private static MetricBucket bucket(DimensionKey key, int count) {
        return bucket(key, count, 0.0, 0.0);
    }

    private static MetricBucket bucket(DimensionKey key, int count, double ratio, double rate) {
        List<ParsedEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(error("auth", "DB_TIMEOUT", START.plusSeconds(i).toString(), i + 1));
        }
        return MetricBucket.builder()
                .windowStart(START)
                .windowEnd(START.plusSeconds(60))
                .key(key)
                .count(count)
                .ratio(ratio)
                .rate(rate)
                .signatures(Set.of())
                .events(events)
                .build();
    }

    private static BaselineLookup baseline(Map<DimensionKey, Baseline> entries) {
        return new InMemoryBaselineLookup(entries);
    }

    private List<Anomaly> detect(MetricBucket bucket, BaselineLookup baseline) {
        return detector.detect(List.of(bucket), baseline, ThresholdConfig.DEFAULTS);
    }

    @Nested
    @DisplayName("Deviation scoring")
    class ScoringTests {

        @Test
        @DisplayName("Should emit a HIGH spike at or above the high threshold")
        void shouldEmitHighSpike() {
            List<Anomaly> anomalies = detect(bucket(AUTH, 6), baseline(Map.of(AUTH, Baseline.of(2, 1))));

            assertEquals(1, anomalies.size());
            Anomaly spike = anomalies.get(0);
            assertEquals(AnomalyKind.SPIKE, spike.getKind());
            assertEquals(Confidence.HIGH, spike.getConfidence());
            assertEquals(6.0, spike.getObservedValue());
            assertEquals(2.0, spike.getExpectedValue());
            assertEquals(4.0, spike.getDeviationScore(), 1e-9);
            assertEquals("SPIKE@" + START.toEpochMilli() + "/auth|*|*", spike.getId());
        }

        @Test
        @DisplayName("Should emit a MEDIUM spike between the thresholds")
        void shouldEmitMediumSpike() {
            List<Anomaly> anomalies = detect(bucket(AUTH, 4), baseline(Map.of(AUTH, Baseline.of(2, 1))));

            assertEquals(Confidence.MEDIUM, anomalies.get(0).getConfidence());
        }

        @Test
        @DisplayName("Should stay silent below the medium threshold and for drops")
        void shouldStaySilentBelowThreshold() {
            assertTrue(detect(bucket(AUTH, 3), baseline(Map.of(AUTH, Baseline.of(2, 1)))).isEmpty());
            assertTrue(detect(bucket(AUTH, 1), baseline(Map.of(AUTH, Baseline.of(10, 1)))).isEmpty());
        }

        @Test
        @DisplayName("Should compare the ratio for RATIO baselines")
        void shouldCompareRatio() {
            List<Anomaly> anomalies = detect(bucket(AUTH, 9, 0.6, 0.0),
                    baseline(Map.of(AUTH, Baseline.of(0.1, 0.05, MetricKind.RATIO))));

            assertEquals(AnomalyKind.SPIKE, anomalies.get(0).getKind());
            assertEquals(0.6, anomalies.get(0).getObservedValue(), 1e-9);
            assertEquals(10.0, anomalies.get(0).getDeviationScore(), 1e-9);
        }

        @Test
        @DisplayName("Should report RATE baselines as rate increases")
        void shouldReportRateIncrease() {
            List<Anomaly> anomalies = detect(bucket(AUTH, 60, 0.0, 1.0),
                    baseline(Map.of(AUTH, Baseline.of(0.1, 0.1, MetricKind.RATE))));

            assertEquals(AnomalyKind.RATE_INCREASE, anomalies.get(0).getKind());
            assertEquals(Confidence.HIGH, anomalies.get(0).getConfidence());
        }

        @Test
        @DisplayName("Should guard zero variability with epsilon")
        void shouldGuardZeroVariability() {
            List<Anomaly> anomalies = detect(bucket(AUTH, 3), baseline(Map.of(AUTH, Baseline.of(2, 0))));

            assertEquals(1.0 / 1e-6, anomalies.get(0).getDeviationScore(), 1e-3);
            assertEquals(Confidence.HIGH, anomalies.get(0).getConfidence());
        }

        @Test
        @DisplayName("Should honor configured thresholds")
        void shouldHonorConfiguredThresholds() {
            ThresholdConfig strict = ThresholdConfig.builder().medium(5).high(10).build();

            List<Anomaly> anomalies = detector.detect(List.of(bucket(AUTH, 6)),
                    baseline(Map.of(AUTH, Baseline.of(2, 1))), strict);

            assertTrue(anomalies.isEmpty());
        }
    }

    @Nested
    @DisplayName("Missing baselines and new signatures")
    class MissingBaselineTests {

        @Test
        @DisplayName("Should emit exactly one MISSING_BASELINE for an unknown key")
        void shouldEmitMissingBaseline() {
            List<Anomaly> anomalies = detect(bucket(AUTH, 5), BaselineLookup.empty());

            assertEquals(1, anomalies.size());
            Anomaly missing = anomalies.get(0);
            assertEquals(AnomalyKind.MISSING_BASELINE, missing.getKind());
            assertEquals(Confidence.LOW, missing.getConfidence());
            assertEquals(0.0, missing.getDeviationScore());
            assertNull(missing.getExpectedValue());
            assertEquals(5.0, missing.getObservedValue());
        }

        @Test
        @DisplayName("Should treat a non-finite baseline as missing")
        void shouldTreatNonFiniteBaselineAsMissing() {
            List<Anomaly> anomalies = detect(bucket(AUTH, 5),
                    baseline(Map.of(AUTH, Baseline.of(Double.NaN, 1))));

            assertEquals(AnomalyKind.MISSING_BASELINE, anomalies.get(0).getKind());
        }

        @Test
        @DisplayName("Should flag a signature without any history")
        void shouldFlagNewSignature() {
            List<Anomaly> anomalies = detect(bucket(AUTH_DB, 2), BaselineLookup.empty());

            assertEquals(List.of(AnomalyKind.NEW_SIGNATURE, AnomalyKind.MISSING_BASELINE),
                    anomalies.stream().map(Anomaly::getKind).collect(Collectors.toList()));
            Anomaly fresh = anomalies.get(0);
            assertEquals(Confidence.HIGH, fresh.getConfidence());
            assertEquals(0.0, fresh.getExpectedValue());
            assertEquals(ThresholdConfig.DEFAULTS.getHigh(), fresh.getDeviationScore());
        }

        @Test
        @DisplayName("Should not flag a signature known for any service")
        void shouldNotFlagGloballyKnownSignature() {
            DimensionKey anyDb = DimensionKey.of(null, (String) null, "DB_TIMEOUT");

            List<Anomaly> anomalies = detect(bucket(AUTH_DB, 2), baseline(Map.of(anyDb, Baseline.of(1, 1))));

            assertEquals(List.of(AnomalyKind.MISSING_BASELINE),
                    anomalies.stream().map(Anomaly::getKind).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should not flag a signature with an exact baseline")
        void shouldNotFlagKnownSignature() {
            List<Anomaly> anomalies = detect(bucket(AUTH_DB, 2), baseline(Map.of(AUTH_DB, Baseline.of(2, 1))));

            assertTrue(anomalies.isEmpty());
        }

        @Test
        @DisplayName("Should not flag a cross-service signature seen under another service")
        void shouldNotFlagCrossServiceSignatureWithHistory() {
            DimensionKey anyDb = DimensionKey.of(null, (String) null, "DB_TIMEOUT");
            DimensionKey paymentDb = DimensionKey.of("payment", "ERROR", "DB_TIMEOUT");

            List<Anomaly> anomalies = detect(bucket(anyDb, 1), baseline(Map.of(paymentDb, Baseline.of(1, 1))));

            assertEquals(List.of(AnomalyKind.MISSING_BASELINE),
                    anomalies.stream().map(Anomaly::getKind).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should still flag a service signature known only elsewhere")
        void shouldFlagServiceSignatureKnownOnlyElsewhere() {
            DimensionKey paymentDb = DimensionKey.of("payment", "ERROR", "DB_TIMEOUT");

            List<Anomaly> anomalies = detect(bucket(AUTH_DB, 1), baseline(Map.of(paymentDb, Baseline.of(1, 1))));

            assertTrue(anomalies.stream().anyMatch(anomaly -> anomaly.getKind() == AnomalyKind.NEW_SIGNATURE));
        }
    }

    @Nested
    @DisplayName("Evidence and ranking")
    class EvidenceTests {

        @Test
        @DisplayName("Should cap evidence and list the most recent events first")
        void shouldCapEvidence() {
            ThresholdConfig thresholds = ThresholdConfig.builder().evidenceCap(3).build();

            List<Anomaly> anomalies = detector.detect(List.of(bucket(AUTH, 8)), BaselineLookup.empty(), thresholds);

            assertEquals(List.of(8L, 7L, 6L), anomalies.get(0).getEvidence().stream()
                    .map(ParsedEvent::getLineNumber)
                    .collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should rank by deviation, then confidence, then key")
        void shouldRankAnomalies() {
            DimensionKey billing = DimensionKey.service("billing");
            DimensionKey api = DimensionKey.service("api");
            BaselineLookup lookup = baseline(Map.of(
                    AUTH, Baseline.of(2, 1),
                    billing, Baseline.of(2, 1)));

            List<Anomaly> anomalies = detector.detect(List.of(
                    bucket(api, 1),
                    bucket(billing, 6),
                    bucket(AUTH, 6)), lookup, ThresholdConfig.DEFAULTS);

            assertEquals(List.of("auth|*|*", "billing|*|*", "api|*|*"), anomalies.stream()
                    .map(a -> a.getKey().asString())
                    .collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should produce equal results on repeated runs")
        void shouldBeRepeatable() {
            List<MetricBucket> buckets = List.of(bucket(AUTH, 6), bucket(AUTH_DB, 3));
            BaselineLookup lookup = baseline(Map.of(AUTH, Baseline.of(2, 1)));

            assertEquals(detector.detect(buckets, lookup, ThresholdConfig.DEFAULTS),
                    detector.detect(buckets, lookup, ThresholdConfig.DEFAULTS));
        }
    }

    @Test
    @DisplayName("Should return no anomalies for empty input")
    void shouldReturnEmptyForEmptyInput() {
        assertTrue(detector.detect(List.of(), BaselineLookup.empty(), ThresholdConfig.DEFAULTS).isEmpty());
    }

    @Test
    @DisplayName("Should reject invalid thresholds")
    void shouldRejectInvalidThresholds() {
        ThresholdConfig inverted = ThresholdConfig.builder().medium(3).high(2).build();

        ConfigException ex = assertThrows(ConfigException.class,
                () -> detector.detect(List.of(bucket(AUTH, 1)), BaselineLookup.empty(), inverted));
        assertEquals("thresholds.high", ex.getField());
    }
}
