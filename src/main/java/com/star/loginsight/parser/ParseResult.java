package com.star.loginsight.parser;

import com.star.loginsight.model.ParsedEvent;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of parsing one line. Every status carries an event; the status only
 * says how much of it came from a rule.
 *
 * <p>Represents degraded parses without throwing in the hot path.
 */
@Getter
@Builder
public class ParseResult {

    public enum Status {
        /** A rule matched and every mapped field was extracted. */
        MATCHED,
        /** No rule matched; the event is a raw UNKNOWN-severity record. */
        UNMATCHED,
        /** A rule matched but extraction failed; fell back to the raw record. */
        DEGRADED
    }

    private final Status status;
    private final ParsedEvent event;
    private final String errorMessage;

    public static ParseResult matched(ParsedEvent event) {
        return ParseResult.builder()
                .status(Status.MATCHED)
                .event(event)
                .build();
    }

    public static ParseResult unmatched(ParsedEvent event) {
        return ParseResult.builder()
                .status(Status.UNMATCHED)
                .event(event)
                .build();
    }

    public static ParseResult degraded(ParsedEvent event, String errorMessage) {
        return ParseResult.builder()
                .status(Status.DEGRADED)
                .event(event)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    public boolean isUnmatched() {
        return status == Status.UNMATCHED;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isTimestampInferred() {
        return event.isTimestampInferred();
    }

    @Override
    public String toString() {
        return String.format("ParseResult{status=%s, ref=%s, error='%s'}",
                status, event.getReference(), errorMessage != null ? errorMessage : "none");
    }
}
