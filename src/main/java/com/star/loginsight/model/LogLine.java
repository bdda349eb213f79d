package com.star.loginsight.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One raw line as handed over by a fetch collaborator.
 */
@Value
@Builder(toBuilder = true)
public class LogLine {

    @NonNull
    String text;

    @NonNull
    String sourceId;

    @NonNull
    Instant ingestedAt;

    long lineNumber;  // 1-based position within its source

    public static LogLine of(String sourceId, long lineNumber, String text, Instant ingestedAt) {
        return new LogLine(text, sourceId, ingestedAt, lineNumber);
    }
}
