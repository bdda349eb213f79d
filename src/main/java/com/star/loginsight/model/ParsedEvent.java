package com.star.loginsight.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

/**
 * Canonical form of a single log line. Exactly one is produced per {@link LogLine}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedEvent {

    public static final String UNKNOWN_SERVICE = "unknown";

    /**
     * Chronological order with source id, line number and raw text as tie breakers.
     * Events equal under this order are equal in every field that reaches a report.
     */
    public static final Comparator<ParsedEvent> CHRONOLOGICAL = Comparator
            .comparing(ParsedEvent::getTimestamp)
            .thenComparing(ParsedEvent::getSourceId)
            .thenComparingLong(ParsedEvent::getLineNumber)
            .thenComparing(ParsedEvent::getRaw);

    @NonNull
    Instant timestamp;

    boolean timestampInferred;

    @NonNull
    String service;

    @NonNull
    Severity severity;

    @NonNull
    String message;

    String errorSignature;

    @NonNull
    String raw;

    String sourcePatternId;

    @NonNull
    String sourceId;

    long lineNumber;

    @Singular
    Map<String, String> attributes;

    @JsonIgnore
    public boolean isMatched() {
        return sourcePatternId != null;
    }

    /** Stable reference used by hypotheses to point back at evidence. */
    @JsonIgnore
    public String getReference() {
        return sourceId + ":" + lineNumber;
    }
}
