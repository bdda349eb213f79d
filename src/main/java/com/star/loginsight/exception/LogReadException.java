package com.star.loginsight.exception;

public class LogReadException extends AnalysisException {
    public LogReadException(String message) {
        super(message);
    }

    public LogReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
