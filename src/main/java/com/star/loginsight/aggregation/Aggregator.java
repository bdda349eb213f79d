package com.star.loginsight.aggregation;

import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.model.DimensionKey;
import com.star.loginsight.model.DimensionSpec;
import com.star.loginsight.model.MetricBucket;
import com.star.loginsight.model.ParsedEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups events into epoch-aligned, half-open windows and counts them per
 * dimension key.
 *
 * <p>Each window also gets a synthetic {@link DimensionKey#TOTAL} bucket. Ratios
 * use the {@code (service,*,*)} bucket of the same window as denominator when it
 * exists and the window total otherwise. Windows without events produce no
 * buckets.
 */
@Slf4j
public class Aggregator {

    public static final Set<DimensionSpec> DEFAULT_DIMENSIONS = Collections.unmodifiableSet(EnumSet.of(
            DimensionSpec.SERVICE,
            DimensionSpec.SERVICE_SEVERITY,
            DimensionSpec.SERVICE_SIGNATURE
    ));

    public List<MetricBucket> aggregate(Collection<ParsedEvent> events, Duration windowSize) {
        return aggregate(events, windowSize, DEFAULT_DIMENSIONS);
    }

    /**
     * @return buckets ordered by window start, then key
     * @throws ConfigException if the window size is not positive
     */
    public List<MetricBucket> aggregate(Collection<ParsedEvent> events,
                                        Duration windowSize,
                                        Set<DimensionSpec> dimensions) {
        long windowMillis = validateWindow(windowSize);
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        Set<DimensionSpec> specs = dimensions != null ? dimensions : DEFAULT_DIMENSIONS;

        List<ParsedEvent> ordered = new ArrayList<>(events);
        ordered.sort(ParsedEvent.CHRONOLOGICAL);

        // window start (epoch millis) -> key -> contributing events
        Map<Long, Map<DimensionKey, List<ParsedEvent>>> windows = new TreeMap<>();

        for (ParsedEvent event : ordered) {
            long windowStart = Math.floorDiv(event.getTimestamp().toEpochMilli(), windowMillis) * windowMillis;
            Map<DimensionKey, List<ParsedEvent>> window = windows.computeIfAbsent(windowStart, k -> new TreeMap<>());

            window.computeIfAbsent(DimensionKey.TOTAL, k -> new ArrayList<>()).add(event);
            specs.stream()
                    .map(spec -> spec.project(event))
                    .filter(Objects::nonNull)
                    .distinct()
                    .filter(key -> !key.isTotal())
                    .forEach(key -> window.computeIfAbsent(key, k -> new ArrayList<>()).add(event));
        }

        double windowSeconds = windowMillis / 1000.0;
        List<MetricBucket> buckets = new ArrayList<>();

        windows.forEach((start, window) -> {
            Instant windowStart = Instant.ofEpochMilli(start);
            Instant windowEnd = windowStart.plusMillis(windowMillis);
            long total = window.get(DimensionKey.TOTAL).size();

            window.forEach((key, contributors) -> {
                long denominator = denominatorFor(key, window, total);
                buckets.add(MetricBucket.builder()
                        .windowStart(windowStart)
                        .windowEnd(windowEnd)
                        .key(key)
                        .count(contributors.size())
                        .rate(contributors.size() / windowSeconds)
                        .ratio(denominator > 0 ? (double) contributors.size() / denominator : 0.0)
                        .signatures(signaturesOf(contributors))
                        .events(List.copyOf(contributors))
                        .build());
            });
        });

        log.debug("Aggregated {} events into {} buckets across {} windows",
                ordered.size(), buckets.size(), windows.size());
        return Collections.unmodifiableList(buckets);
    }

    private long denominatorFor(DimensionKey key, Map<DimensionKey, List<ParsedEvent>> window, long total) {
        if (key.hasService()) {
            List<ParsedEvent> serviceEvents = window.get(DimensionKey.service(key.getService()));
            if (serviceEvents != null) {
                return serviceEvents.size();
            }
        }
        return total;
    }

    private SortedSet<String> signaturesOf(List<ParsedEvent> events) {
        SortedSet<String> signatures = new TreeSet<>();
        for (ParsedEvent event : events) {
            if (event.getErrorSignature() != null) {
                signatures.add(event.getErrorSignature());
            }
        }
        return Collections.unmodifiableSortedSet(signatures);
    }

    private long validateWindow(Duration windowSize) {
        if (windowSize == null || windowSize.isZero() || windowSize.isNegative() || windowSize.toMillis() < 1) {
            throw ConfigException.invalidField("window-size", windowSize, "must be at least one millisecond");
        }
        return windowSize.toMillis();
    }
}
