package com.star.loginsight.model;

public enum AnomalyKind {
    SPIKE,
    NEW_SIGNATURE,
    RATE_INCREASE,
    MISSING_BASELINE
}
