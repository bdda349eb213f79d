package com.star.loginsight.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polled by the pipeline between stages.
 */
@FunctionalInterface
public interface CancellationSignal {

    boolean isCancelled();

    static CancellationSignal none() {
        return () -> false;
    }

    static CancellationSignal of(AtomicBoolean flag) {
        return flag::get;
    }
}
