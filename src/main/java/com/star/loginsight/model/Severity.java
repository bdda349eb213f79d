package com.star.loginsight.model;

import java.util.Locale;

public enum Severity {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL,
    UNKNOWN;

    public boolean isError() {
        return this == ERROR || this == FATAL;
    }

    /**
     * Maps a raw level token, including common aliases, onto a severity.
     * Anything unrecognized is {@link #UNKNOWN}.
     */
    public static Severity normalize(String level) {
        if (level == null || level.isBlank()) {
            return UNKNOWN;
        }

        switch (level.trim().toUpperCase(Locale.ROOT)) {
            case "TRACE":
            case "DEBUG":
            case "FINE":
            case "FINER":
            case "FINEST":
            case "VERBOSE":
                return DEBUG;
            case "INFO":
            case "CONFIG":
            case "NOTICE":
                return INFO;
            case "WARN":
            case "WARNING":
                return WARN;
            case "ERROR":
            case "ERR":
            case "SEVERE":
                return ERROR;
            case "FATAL":
            case "CRITICAL":
            case "CRIT":
            case "EMERG":
            case "ALERT":
                return FATAL;
            default:
                return UNKNOWN;
        }
    }
}
