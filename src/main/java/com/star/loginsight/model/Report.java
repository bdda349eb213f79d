package com.star.loginsight.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.star.loginsight.pipeline.PipelineStage;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Final artifact of a pipeline run, handed to summarizing and recommending
 * collaborators.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of one analysis run")
public class Report {

    @NonNull
    @Schema(description = "Run status")
    ReportStatus status;

    @Schema(description = "Cause of a FAILED or TIMEOUT run")
    String failureCause;

    @Singular("completedStage")
    @Schema(description = "Pipeline stages that completed")
    List<PipelineStage> completedStages;

    @Schema(description = "Number of events parsed, before any truncation")
    long totalEvents;

    @Schema(description = "Whether the events list was cut to the configured limit")
    boolean eventsTruncated;

    @Singular("event")
    @Schema(description = "Parsed events, in input order")
    List<ParsedEvent> events;

    @Singular("metric")
    @Schema(description = "Windowed metric buckets")
    List<MetricBucket> metrics;

    @Singular("anomaly")
    @Schema(description = "Anomalies ranked by deviation")
    List<Anomaly> anomalies;

    @Singular("hypothesis")
    @Schema(description = "Ranked candidate explanations")
    List<Hypothesis> hypotheses;

    @Singular("warning")
    @Schema(description = "Degraded-operation notices")
    List<String> warnings;
}
