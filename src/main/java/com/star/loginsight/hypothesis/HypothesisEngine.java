package com.star.loginsight.hypothesis;

import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.model.Anomaly;
import com.star.loginsight.model.AnomalyKind;
import com.star.loginsight.model.Confidence;
import com.star.loginsight.model.DimensionKey;
import com.star.loginsight.model.Hypothesis;
import com.star.loginsight.model.ParsedEvent;
import com.star.loginsight.parser.SignatureClassifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Groups co-temporal anomalies of one service and states which known error
 * signatures they co-occur with. Statements describe association only.
 */
@Slf4j
public class HypothesisEngine {

    static final String CORRELATION_NOT_CAUSATION =
            "correlation is not causation: the signatures co-occur with the anomalies, no causal direction is established";
    static final String SINGLE_ANOMALY = "based on a single anomaly";
    static final String NO_KNOWN_SIGNATURE = "no specific error signature found in the evidence";

    private static final Comparator<Anomaly> SWEEP_ORDER = Comparator
            .comparing(Anomaly::getService)
            .thenComparing(Anomaly::getWindowStart)
            .thenComparing(Anomaly::getId);

    private static final Comparator<Group> OUTPUT_ORDER = Comparator
            .comparing(Group::confidence, Comparator.reverseOrder())
            .thenComparing(Group::size, Comparator.reverseOrder())
            .thenComparing(Group::getService)
            .thenComparing(Group::getStart);

    public List<Hypothesis> hypothesize(List<Anomaly> anomalies, Duration correlationWindow) {
        if (correlationWindow == null || correlationWindow.isNegative()) {
            throw ConfigException.invalidField("correlation-window", correlationWindow, "must be zero or positive");
        }
        if (anomalies == null || anomalies.isEmpty()) {
            return List.of();
        }

        List<Anomaly> candidates = anomalies.stream()
                .filter(Anomaly::hasEvidence)
                .sorted(SWEEP_ORDER)
                .collect(Collectors.toList());

        List<Group> groups = new ArrayList<>();
        Group open = null;
        for (Anomaly anomaly : candidates) {
            if (open != null && open.accepts(anomaly, correlationWindow)) {
                open.add(anomaly);
            } else {
                open = new Group(anomaly);
                groups.add(open);
            }
        }

        groups.sort(OUTPUT_ORDER);
        List<Hypothesis> hypotheses = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            hypotheses.add(groups.get(i).toHypothesis(String.format("H-%03d", i + 1)));
        }

        log.debug("Built {} hypotheses from {} anomalies ({} without evidence ignored)",
                hypotheses.size(), anomalies.size(), anomalies.size() - candidates.size());
        return Collections.unmodifiableList(hypotheses);
    }

    private static final class Group {

        private final String service;
        private final Instant start;
        private Instant end;
        private final List<Anomaly> members = new ArrayList<>();

        Group(Anomaly first) {
            this.service = first.getService();
            this.start = first.getWindowStart();
            this.end = first.getWindowEnd();
            members.add(first);
        }

        boolean accepts(Anomaly anomaly, Duration correlationWindow) {
            return service.equals(anomaly.getService())
                    && anomaly.getWindowStart().isBefore(end.plus(correlationWindow));
        }

        void add(Anomaly anomaly) {
            members.add(anomaly);
            if (anomaly.getWindowEnd().isAfter(end)) {
                end = anomaly.getWindowEnd();
            }
        }

        String getService() {
            return service;
        }

        Instant getStart() {
            return start;
        }

        int size() {
            return members.size();
        }

        Confidence confidence() {
            Confidence lowest = Confidence.HIGH;
            for (Anomaly member : members) {
                lowest = Confidence.min(lowest, member.getConfidence());
            }
            return knownSignatures().isEmpty() ? Confidence.LOW : lowest;
        }

        SortedSet<String> knownSignatures() {
            SortedSet<String> signatures = new TreeSet<>();
            for (Anomaly member : members) {
                addKnown(signatures, member.getKey().hasSignature() ? member.getKey().getErrorSignature() : null);
                for (ParsedEvent event : member.getEvidence()) {
                    addKnown(signatures, event.getErrorSignature());
                }
            }
            return signatures;
        }

        Hypothesis toHypothesis(String id) {
            SortedSet<String> signatures = knownSignatures();
            return Hypothesis.builder()
                    .id(id)
                    .service(service)
                    .windowStart(start)
                    .windowEnd(end)
                    .anomalyRefs(members.stream().map(Anomaly::getId).collect(Collectors.toCollection(TreeSet::new)))
                    .statement(signatures.isEmpty() ? Hypothesis.INSUFFICIENT_EVIDENCE : statement(signatures))
                    .confidence(confidence())
                    .signatures(Collections.unmodifiableSortedSet(signatures))
                    .evidenceRefs(evidenceRefs())
                    .uncertaintyFactors(uncertaintyFactors(signatures))
                    .build();
        }

        private String statement(SortedSet<String> signatures) {
            String kinds = members.stream()
                    .map(Anomaly::getKind)
                    .distinct()
                    .sorted()
                    .map(AnomalyKind::name)
                    .collect(Collectors.joining(", "));
            return String.format("%d anomal%s (%s) on %s between %s and %s co-occur with error signature%s %s",
                    members.size(), members.size() == 1 ? "y" : "ies", kinds, service, start, end,
                    signatures.size() == 1 ? "" : "s", String.join(", ", signatures));
        }

        // Chronological, one reference per contributing line.
        private List<String> evidenceRefs() {
            Map<String, ParsedEvent> unique = new LinkedHashMap<>();
            members.stream()
                    .flatMap(member -> member.getEvidence().stream())
                    .sorted(ParsedEvent.CHRONOLOGICAL)
                    .forEach(event -> unique.putIfAbsent(event.getReference(), event));
            return List.copyOf(unique.keySet());
        }

        private List<String> uncertaintyFactors(SortedSet<String> signatures) {
            List<String> factors = new ArrayList<>();
            factors.add(CORRELATION_NOT_CAUSATION);
            long withoutBaseline = members.stream()
                    .filter(member -> member.getKind() == AnomalyKind.MISSING_BASELINE)
                    .map(Anomaly::getKey)
                    .distinct()
                    .count();
            long dimensions = members.stream().map(Anomaly::getKey).distinct().count();
            if (withoutBaseline > 0) {
                factors.add(String.format("%d of %d dimensions lack a baseline", withoutBaseline, dimensions));
            }
            if (members.size() == 1) {
                factors.add(SINGLE_ANOMALY);
            }
            if (signatures.isEmpty()) {
                factors.add(NO_KNOWN_SIGNATURE);
            }
            return List.copyOf(factors);
        }

        private static void addKnown(SortedSet<String> signatures, String signature) {
            if (signature != null
                    && !DimensionKey.WILDCARD.equals(signature)
                    && !SignatureClassifier.GENERIC_ERROR.equals(signature)) {
                signatures.add(signature);
            }
        }
    }
}
