package com.star.loginsight.exception;

/**
 * Base type for every failure raised by the analysis pipeline.
 */
public class AnalysisException extends RuntimeException {
    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
