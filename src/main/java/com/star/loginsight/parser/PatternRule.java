package com.star.loginsight.parser;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One configured line pattern: an id, a regular expression matched against the
 * whole raw line, and a map from capture group (name or index) to target field.
 *
 * <p>Recognized targets are {@value #TIMESTAMP}, {@value #SERVICE},
 * {@value #SEVERITY}, {@value #MESSAGE} and {@value #ERROR_SIGNATURE}; any other
 * target is stored as an event attribute under that name.
 */
@Value
@Builder(toBuilder = true)
public class PatternRule {

    public static final String TIMESTAMP = "timestamp";
    public static final String SERVICE = "service";
    public static final String SEVERITY = "severity";
    public static final String MESSAGE = "message";
    public static final String ERROR_SIGNATURE = "error_signature";

    @NonNull
    String id;

    @NonNull
    String regex;

    @Singular("field")
    Map<String, String> fields;

    /** Optional {@link java.time.format.DateTimeFormatter} pattern tried before auto-detection. */
    String timestampFormat;
}
