package com.star.loginsight.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Count of events for one dimension key inside one half-open window
 * {@code [windowStart, windowEnd)}.
 */
@Value
@Builder
public class MetricBucket {

    @NonNull
    Instant windowStart;

    @NonNull
    Instant windowEnd;

    @NonNull
    DimensionKey key;

    long count;

    /** Events per second over the window. */
    double rate;

    /** Share of the per-service bucket, or of the window total when there is none. */
    double ratio;

    Set<String> signatures;

    /** Contributing events in chronological order; kept out of serialized reports. */
    @JsonIgnore
    List<ParsedEvent> events;

    public double valueOf(MetricKind metric) {
        switch (metric) {
            case RATIO:
                return ratio;
            case RATE:
                return rate;
            case COUNT:
            default:
                return count;
        }
    }
}
