package com.star.loginsight.exception;

import lombok.Getter;

/**
 * A single line that could not be fully extracted. Never escapes the parse stage.
 */
@Getter
public class RecoverableParseException extends AnalysisException {
    private final String sourceId;
    private final long lineNumber;

    public RecoverableParseException(String sourceId, long lineNumber, String message, Throwable cause) {
        super(String.format("%s:%d: %s", sourceId, lineNumber, message), cause);
        this.sourceId = sourceId;
        this.lineNumber = lineNumber;
    }
}
