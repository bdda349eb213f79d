package com.star.loginsight.hypothesis;

import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.model.Anomaly;
import com.star.loginsight.model.AnomalyKind;
import com.star.loginsight.model.Confidence;
import com.star.loginsight.model.DimensionKey;
import com.star.loginsight.model.Hypothesis;
import com.star.loginsight.model.ParsedEvent;
import com.star.loginsight.parser.SignatureClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.star.loginsight.model.TestEvents.error;
import static org.junit.jupiter.api.Assertions.*;

class HypothesisEngineTest {

    private static final Instant BASE = Instant.parse("2024-01-15T10:00:00Z");

    private HypothesisEngine engine;

    @BeforeEach
    void setUp() {
        engine = new HypothesisEngine();
    }

    private static Anomaly anomaly(DimensionKey key, AnomalyKind kind, Confidence confidence,
                                   int minute, List<ParsedEvent> evidence) {
        Instant start = BASE.plus(Duration.ofMinutes(minute));
        return Anomaly.builder()
                .id(Anomaly.idFor(kind, key, start))
                .key(key)
                .kind(kind)
                .observedValue(evidence.size())
                .deviationScore(kind == AnomalyKind.MISSING_BASELINE ? 0 : 3)
                .confidence(confidence)
                .evidence(evidence)
                .windowStart(start)
                .windowEnd(start.plus(Duration.ofMinutes(1)))
                .build();
    }

    private static ParsedEvent dbTimeout(int minute, long line) {
        return error("auth", "DB_TIMEOUT", BASE.plus(Duration.ofMinutes(minute)).plusSeconds(line).toString(), line);
    }

    private static ParsedEvent authFailed(int minute, long line) {
        return error("auth", "AUTH_FAILED", BASE.plus(Duration.ofMinutes(minute)).plusSeconds(line).toString(), line);
    }

    @Nested
    @DisplayName("Grouping")
    class GroupingTests {

        @Test
        @DisplayName("Should ignore anomalies without evidence")
        void shouldIgnoreAnomaliesWithoutEvidence() {
            Anomaly empty = anomaly(DimensionKey.service("auth"), AnomalyKind.SPIKE, Confidence.HIGH, 0, List.of());

            assertTrue(engine.hypothesize(List.of(empty), Duration.ofMinutes(5)).isEmpty());
        }

        @Test
        @DisplayName("Should merge anomalies of one service within the correlation window")
        void shouldMergeWithinCorrelationWindow() {
            List<Anomaly> anomalies = List.of(
                    anomaly(DimensionKey.service("auth"), AnomalyKind.SPIKE, Confidence.HIGH, 0, List.of(dbTimeout(0, 1))),
                    anomaly(DimensionKey.of("auth", "ERROR", null), AnomalyKind.SPIKE, Confidence.HIGH, 1,
                            List.of(authFailed(1, 2))));

            List<Hypothesis> merged = engine.hypothesize(anomalies, Duration.ofMinutes(1));
            List<Hypothesis> separate = engine.hypothesize(anomalies, Duration.ZERO);

            assertEquals(1, merged.size());
            assertEquals(BASE, merged.get(0).getWindowStart());
            assertEquals(BASE.plus(Duration.ofMinutes(2)), merged.get(0).getWindowEnd());
            assertEquals(2, merged.get(0).getAnomalyRefs().size());
            assertEquals(2, separate.size());
        }

        @Test
        @DisplayName("Should never group anomalies of different services")
        void shouldSeparateServices() {
            List<Anomaly> anomalies = List.of(
                    anomaly(DimensionKey.service("auth"), AnomalyKind.SPIKE, Confidence.HIGH, 0, List.of(dbTimeout(0, 1))),
                    anomaly(DimensionKey.service("billing"), AnomalyKind.SPIKE, Confidence.HIGH, 0,
                            List.of(error("billing", "DB_TIMEOUT", "2024-01-15T10:00:30Z", 9))));

            List<Hypothesis> hypotheses = engine.hypothesize(anomalies, Duration.ofMinutes(5));

            assertEquals(Set.of("auth", "billing"),
                    hypotheses.stream().map(Hypothesis::getService).collect(Collectors.toSet()));
        }

        @Test
        @DisplayName("Should reject a negative correlation window")
        void shouldRejectNegativeCorrelationWindow() {
            ConfigException ex = assertThrows(ConfigException.class,
                    () -> engine.hypothesize(List.of(), Duration.ofSeconds(-1)));
            assertEquals("correlation-window", ex.getField());
        }
    }

    @Nested
    @DisplayName("Statements and confidence")
    class StatementTests {

        @Test
        @DisplayName("Should name known signatures and take the lowest confidence")
        void shouldNameSignatures() {
            List<Anomaly> anomalies = List.of(
                    anomaly(DimensionKey.of("auth", "ERROR", null), AnomalyKind.SPIKE, Confidence.HIGH, 0,
                            List.of(dbTimeout(0, 1), authFailed(0, 2))),
                    anomaly(DimensionKey.service("auth"), AnomalyKind.SPIKE, Confidence.MEDIUM, 0,
                            List.of(dbTimeout(0, 3))));

            Hypothesis hypothesis = engine.hypothesize(anomalies, Duration.ofMinutes(5)).get(0);

            assertEquals("H-001", hypothesis.getId());
            assertEquals(Confidence.MEDIUM, hypothesis.getConfidence());
            assertEquals(Set.of("AUTH_FAILED", "DB_TIMEOUT"), hypothesis.getSignatures());
            assertTrue(hypothesis.getStatement().contains("AUTH_FAILED, DB_TIMEOUT"));
            assertTrue(hypothesis.getStatement().contains("co-occur"));
            assertFalse(hypothesis.getStatement().contains("caused"));
            assertEquals(List.of("auth.log:1", "auth.log:2", "auth.log:3"), hypothesis.getEvidenceRefs());
        }

        @Test
        @DisplayName("Should collect signatures from anomaly keys")
        void shouldCollectSignaturesFromKeys() {
            ParsedEvent unsigned = error("auth", null, "2024-01-15T10:00:10Z", 1);
            Anomaly anomaly = anomaly(DimensionKey.of("auth", (String) null, "OOM"), AnomalyKind.NEW_SIGNATURE,
                    Confidence.HIGH, 0, List.of(unsigned));

            Hypothesis hypothesis = engine.hypothesize(List.of(anomaly), Duration.ofMinutes(5)).get(0);

            assertEquals(Set.of("OOM"), hypothesis.getSignatures());
        }

        @Test
        @DisplayName("Should admit insufficient evidence without a known signature")
        void shouldAdmitInsufficientEvidence() {
            Anomaly generic = anomaly(DimensionKey.service("auth"), AnomalyKind.SPIKE, Confidence.HIGH, 0,
                    List.of(error("auth", SignatureClassifier.GENERIC_ERROR, "2024-01-15T10:00:10Z", 1)));

            Hypothesis hypothesis = engine.hypothesize(List.of(generic), Duration.ofMinutes(5)).get(0);

            assertEquals(Hypothesis.INSUFFICIENT_EVIDENCE, hypothesis.getStatement());
            assertEquals(Confidence.LOW, hypothesis.getConfidence());
            assertTrue(hypothesis.getSignatures().isEmpty());
            assertTrue(hypothesis.getUncertaintyFactors().contains(HypothesisEngine.NO_KNOWN_SIGNATURE));
        }

        @Test
        @DisplayName("Should list uncertainty factors")
        void shouldListUncertaintyFactors() {
            Anomaly single = anomaly(DimensionKey.service("auth"), AnomalyKind.MISSING_BASELINE, Confidence.LOW, 0,
                    List.of(dbTimeout(0, 1)));

            Hypothesis hypothesis = engine.hypothesize(List.of(single), Duration.ofMinutes(5)).get(0);

            assertEquals(List.of(
                    HypothesisEngine.CORRELATION_NOT_CAUSATION,
                    "1 of 1 dimensions lack a baseline",
                    HypothesisEngine.SINGLE_ANOMALY), hypothesis.getUncertaintyFactors());
        }
    }

    @Test
    @DisplayName("Should order by confidence, then anomaly count, then service")
    void shouldOrderHypotheses() {
        List<Anomaly> anomalies = List.of(
                anomaly(DimensionKey.service("zeta"), AnomalyKind.SPIKE, Confidence.HIGH, 0,
                        List.of(error("zeta", "OOM", "2024-01-15T10:00:01Z", 1))),
                anomaly(DimensionKey.service("alpha"), AnomalyKind.MISSING_BASELINE, Confidence.LOW, 0,
                        List.of(error("alpha", "OOM", "2024-01-15T10:00:02Z", 2))),
                anomaly(DimensionKey.service("beta"), AnomalyKind.SPIKE, Confidence.HIGH, 0,
                        List.of(error("beta", "OOM", "2024-01-15T10:00:03Z", 3))),
                anomaly(DimensionKey.of("beta", "ERROR", null), AnomalyKind.SPIKE, Confidence.HIGH, 0,
                        List.of(error("beta", "OOM", "2024-01-15T10:00:04Z", 4))));

        List<Hypothesis> hypotheses = engine.hypothesize(anomalies, Duration.ofMinutes(5));

        assertEquals(List.of("beta", "zeta", "alpha"),
                hypotheses.stream().map(Hypothesis::getService).collect(Collectors.toList()));
        assertEquals(List.of("H-001", "H-002", "H-003"),
                hypotheses.stream().map(Hypothesis::getId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should never exceed the confidence of any referenced anomaly")
    void shouldBoundConfidence() {
        List<Anomaly> anomalies = List.of(
                anomaly(DimensionKey.service("auth"), AnomalyKind.SPIKE, Confidence.HIGH, 0, List.of(dbTimeout(0, 1))),
                anomaly(DimensionKey.of("auth", "ERROR", null), AnomalyKind.SPIKE, Confidence.MEDIUM, 2,
                        List.of(dbTimeout(2, 2))),
                anomaly(DimensionKey.service("auth"), AnomalyKind.MISSING_BASELINE, Confidence.LOW, 30,
                        List.of(dbTimeout(30, 3))));
        Map<String, Confidence> byId = anomalies.stream()
                .collect(Collectors.toMap(Anomaly::getId, Anomaly::getConfidence));

        for (Hypothesis hypothesis : engine.hypothesize(anomalies, Duration.ofMinutes(5))) {
            for (String ref : hypothesis.getAnomalyRefs()) {
                assertTrue(hypothesis.getConfidence().compareTo(byId.get(ref)) <= 0);
            }
        }
    }
}
