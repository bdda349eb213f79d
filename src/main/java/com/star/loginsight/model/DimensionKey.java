package com.star.loginsight.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifies one metric series: (service, severity, error signature), where any
 * slot may be the wildcard {@value #WILDCARD}.
 */
@Value
public class DimensionKey implements Comparable<DimensionKey> {

    public static final String WILDCARD = "*";

    /** Synthetic per-window total, the denominator of last resort for ratios. */
    public static final DimensionKey TOTAL = new DimensionKey(WILDCARD, WILDCARD, WILDCARD);

    @NonNull
    String service;

    @NonNull
    String severity;

    @NonNull
    String errorSignature;

    public static DimensionKey of(String service, String severity, String errorSignature) {
        return new DimensionKey(
                service != null ? service : WILDCARD,
                severity != null ? severity : WILDCARD,
                errorSignature != null ? errorSignature : WILDCARD);
    }

    public static DimensionKey of(String service, Severity severity, String errorSignature) {
        return of(service, severity != null ? severity.name() : null, errorSignature);
    }

    public static DimensionKey service(String service) {
        return of(service, (String) null, null);
    }

    @JsonIgnore
    public boolean isTotal() {
        return equals(TOTAL);
    }

    @JsonIgnore
    public boolean hasSignature() {
        return !WILDCARD.equals(errorSignature);
    }

    @JsonIgnore
    public boolean hasService() {
        return !WILDCARD.equals(service);
    }

    @JsonValue
    public String asString() {
        return service + "|" + severity + "|" + errorSignature;
    }

    @Override
    public int compareTo(DimensionKey other) {
        return asString().compareTo(other.asString());
    }

    @Override
    public String toString() {
        return asString();
    }
}
