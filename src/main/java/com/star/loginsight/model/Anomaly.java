package com.star.loginsight.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Anomaly {

    /**
     * Ranking order: deviation descending, confidence descending, key ascending.
     * Kind and window start settle whatever is left so the order is total.
     */
    public static final Comparator<Anomaly> RANKING = Comparator
            .comparingDouble(Anomaly::getDeviationScore).reversed()
            .thenComparing(Anomaly::getConfidence, Comparator.reverseOrder())
            .thenComparing(Anomaly::getKey)
            .thenComparing(Anomaly::getKind)
            .thenComparing(Anomaly::getWindowStart);

    @NonNull
    String id;

    @NonNull
    DimensionKey key;

    @NonNull
    AnomalyKind kind;

    double observedValue;

    /** Absent when there was no baseline to compare against. */
    Double expectedValue;

    double deviationScore;

    @NonNull
    Confidence confidence;

    @NonNull
    List<ParsedEvent> evidence;

    @NonNull
    Instant windowStart;

    @NonNull
    Instant windowEnd;

    @JsonIgnore
    public String getService() {
        return key.getService();
    }

    @JsonIgnore
    public boolean hasEvidence() {
        return !evidence.isEmpty();
    }

    public static String idFor(AnomalyKind kind, DimensionKey key, Instant windowStart) {
        return kind.name() + "@" + windowStart.toEpochMilli() + "/" + key.asString();
    }
}
