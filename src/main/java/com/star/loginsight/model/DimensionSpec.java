package com.star.loginsight.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Which event fields are projected into a {@link DimensionKey}. Slots that are not
 * projected collapse to the wildcard.
 */
@Getter
@RequiredArgsConstructor
public enum DimensionSpec {
    SERVICE(true, false, false),
    SERVICE_SEVERITY(true, true, false),
    SERVICE_SIGNATURE(true, false, true),
    SERVICE_SEVERITY_SIGNATURE(true, true, true),
    SEVERITY(false, true, false),
    SIGNATURE(false, false, true);

    private final boolean service;
    private final boolean severity;
    private final boolean signature;

    /**
     * Projects an event onto this spec, or returns {@code null} when the event has
     * no value for a projected slot (an event without a signature never counts
     * toward a signature dimension).
     */
    public DimensionKey project(ParsedEvent event) {
        if (signature && event.getErrorSignature() == null) {
            return null;
        }
        return DimensionKey.of(
                service ? event.getService() : null,
                severity ? event.getSeverity().name() : null,
                signature ? event.getErrorSignature() : null);
    }
}
