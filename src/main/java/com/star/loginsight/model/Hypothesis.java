package com.star.loginsight.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

/**
 * Candidate explanation for a group of co-temporal anomalies on one service.
 * Never claims causal direction.
 */
@Value
@Builder
public class Hypothesis {

    public static final String INSUFFICIENT_EVIDENCE = "insufficient evidence to determine cause";

    @NonNull
    String id;

    @NonNull
    String service;

    @NonNull
    Instant windowStart;

    @NonNull
    Instant windowEnd;

    @NonNull
    SortedSet<String> anomalyRefs;

    @NonNull
    String statement;

    @NonNull
    Confidence confidence;

    @NonNull
    SortedSet<String> signatures;

    @NonNull
    List<String> evidenceRefs;

    @NonNull
    List<String> uncertaintyFactors;
}
