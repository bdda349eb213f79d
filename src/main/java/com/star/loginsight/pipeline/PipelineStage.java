package com.star.loginsight.pipeline;

/**
 * Stages of an analysis run. External stages are performed by collaborators
 * outside the processor and are never executed here.
 */
public enum PipelineStage {

    DISCOVER(true),
    FETCH(true),
    PARSE(false),
    AGGREGATE(false),
    DETECT(false),
    HYPOTHESIZE(false),
    SUMMARIZE(true),
    RECOMMEND(true);

    private final boolean external;

    PipelineStage(boolean external) {
        this.external = external;
    }

    public boolean isExternal() {
        return external;
    }
}
