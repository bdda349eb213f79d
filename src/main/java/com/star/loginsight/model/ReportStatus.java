package com.star.loginsight.model;

public enum ReportStatus {
    OK,
    PARTIAL,
    TIMEOUT,
    FAILED
}
