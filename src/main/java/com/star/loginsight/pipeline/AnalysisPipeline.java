package com.star.loginsight.pipeline;

import com.star.loginsight.aggregation.Aggregator;
import com.star.loginsight.detection.AnomalyDetector;
import com.star.loginsight.detection.BaselineLookup;
import com.star.loginsight.detection.SnapshotBaselineLookup;
import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.hypothesis.HypothesisEngine;
import com.star.loginsight.model.Anomaly;
import com.star.loginsight.model.Hypothesis;
import com.star.loginsight.model.LogLine;
import com.star.loginsight.model.MetricBucket;
import com.star.loginsight.model.ParsedEvent;
import com.star.loginsight.model.Report;
import com.star.loginsight.model.ReportStatus;
import com.star.loginsight.parser.EventParser;
import com.star.loginsight.parser.ParseResult;
import com.star.loginsight.parser.RuleSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs PARSE, AGGREGATE, DETECT and HYPOTHESIZE over one batch of lines and
 * assembles the {@link Report}.
 *
 * <p>Configuration is validated before any line is touched. The deadline and the
 * cancellation signal are checked between stages; when either trips, the
 * artifacts of the completed stages are returned with status TIMEOUT. An
 * unexpected failure inside a stage yields FAILED with the same partial artifacts.
 * Recoverable issues become warnings and downgrade the status to PARTIAL.
 */
@Slf4j
public class AnalysisPipeline {

    static final int MAX_DETAILED_WARNINGS = 10;

    private final EventParser eventParser;
    private final Aggregator aggregator;
    private final AnomalyDetector anomalyDetector;
    private final HypothesisEngine hypothesisEngine;
    private final Clock clock;

    public AnalysisPipeline(EventParser eventParser,
                            Aggregator aggregator,
                            AnomalyDetector anomalyDetector,
                            HypothesisEngine hypothesisEngine,
                            Clock clock) {
        this.eventParser = eventParser;
        this.aggregator = aggregator;
        this.anomalyDetector = anomalyDetector;
        this.hypothesisEngine = hypothesisEngine;
        this.clock = clock;
    }

    public static AnalysisPipeline createDefault() {
        return new AnalysisPipeline(EventParser.createDefault(), new Aggregator(),
                new AnomalyDetector(), new HypothesisEngine(), Clock.systemUTC());
    }

    public Report run(List<LogLine> lines, BaselineLookup baseline, AnalysisOptions options) {
        return run(lines, baseline, options, CancellationSignal.none());
    }

    public Report run(List<LogLine> lines,
                      BaselineLookup baseline,
                      AnalysisOptions options,
                      CancellationSignal cancellation) {
        long startTime = clock.millis();
        AnalysisOptions settings = options != null ? options : AnalysisOptions.defaults();
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();
        List<LogLine> input = lines != null ? lines : List.of();

        RuleSet rules;
        try {
            rules = validate(settings);
        } catch (ConfigException e) {
            log.error("Analysis rejected, invalid configuration: {}", e.getMessage());
            return Report.builder()
                    .status(ReportStatus.FAILED)
                    .failureCause(e.getMessage())
                    .build();
        }

        Instant deadline = settings.getTimeout() != null ? clock.instant().plus(settings.getTimeout()) : null;
        Report.ReportBuilder report = Report.builder();
        List<String> warnings = new ArrayList<>();
        PipelineStage stage = PipelineStage.PARSE;

        try {
            if (interrupted(stage, deadline, signal)) {
                return timeout(report, warnings, stage, deadline, signal);
            }
            List<ParseResult> results = eventParser.parseAll(input, rules);
            List<ParsedEvent> events = results.stream()
                    .map(ParseResult::getEvent)
                    .collect(Collectors.toList());
            warnings.addAll(parseWarnings(results));
            report.totalEvents(events.size());
            reportEvents(report, events, settings.getEventLimit());
            report.completedStage(stage);
            log.info("Parsed {} lines ({} warnings)", events.size(), warnings.size());

            stage = PipelineStage.AGGREGATE;
            if (interrupted(stage, deadline, signal)) {
                return timeout(report, warnings, stage, deadline, signal);
            }
            List<MetricBucket> buckets = aggregator.aggregate(events, settings.getWindowSize(), settings.getDimensions());
            report.metrics(buckets);
            report.completedStage(stage);
            log.info("Aggregated {} events into {} buckets", events.size(), buckets.size());

            stage = PipelineStage.DETECT;
            if (interrupted(stage, deadline, signal)) {
                return timeout(report, warnings, stage, deadline, signal);
            }
            SnapshotBaselineLookup snapshot = new SnapshotBaselineLookup(baseline);
            List<Anomaly> anomalies = anomalyDetector.detect(buckets, snapshot, settings.getThresholds());
            warnings.addAll(snapshot.getWarnings());
            report.anomalies(anomalies);
            report.completedStage(stage);
            log.info("Detected {} anomalies", anomalies.size());

            stage = PipelineStage.HYPOTHESIZE;
            if (interrupted(stage, deadline, signal)) {
                return timeout(report, warnings, stage, deadline, signal);
            }
            List<Hypothesis> hypotheses = hypothesisEngine.hypothesize(anomalies, settings.getCorrelationWindow());
            report.hypotheses(hypotheses);
            report.completedStage(stage);

            ReportStatus status = warnings.isEmpty() ? ReportStatus.OK : ReportStatus.PARTIAL;
            log.info("Analysis completed with status {}. {} events, {} anomalies, {} hypotheses in {} ms",
                    status, events.size(), anomalies.size(), hypotheses.size(), clock.millis() - startTime);
            return report.status(status).warnings(warnings).build();

        } catch (RuntimeException e) {
            log.error("Analysis failed during {}: {}", stage, e.getMessage(), e);
            return report.status(ReportStatus.FAILED)
                    .failureCause(String.format("%s stage failed: %s", stage, describe(e)))
                    .warnings(warnings)
                    .build();
        }
    }

    private RuleSet validate(AnalysisOptions settings) {
        RuleSet rules = RuleSet.compile(settings.getRules());
        if (settings.getThresholds() == null) {
            throw ConfigException.invalidField("thresholds", null, "must be provided");
        }
        settings.getThresholds().validate();
        requirePositive("window-size", settings.getWindowSize());
        Duration correlation = settings.getCorrelationWindow();
        if (correlation == null || correlation.isNegative()) {
            throw ConfigException.invalidField("correlation-window", correlation, "must be zero or positive");
        }
        if (settings.getDimensions() == null || settings.getDimensions().isEmpty()) {
            throw ConfigException.invalidField("dimensions", settings.getDimensions(), "at least one dimension is required");
        }
        if (settings.getEventLimit() != null && settings.getEventLimit() < 0) {
            throw ConfigException.invalidField("event-limit", settings.getEventLimit(), "must not be negative");
        }
        if (settings.getTimeout() != null && settings.getTimeout().isNegative()) {
            throw ConfigException.invalidField("timeout", settings.getTimeout(), "must not be negative");
        }
        return rules;
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw ConfigException.invalidField(field, value, "must be a positive duration");
        }
    }

    private boolean interrupted(PipelineStage next, Instant deadline, CancellationSignal signal) {
        boolean stop = signal.isCancelled() || (deadline != null && !clock.instant().isBefore(deadline));
        if (stop) {
            log.warn("Stopping analysis before {}", next);
        }
        return stop;
    }

    private Report timeout(Report.ReportBuilder report, List<String> warnings, PipelineStage next,
                           Instant deadline, CancellationSignal signal) {
        String cause = signal.isCancelled()
                ? String.format("cancelled before %s", next)
                : String.format("deadline %s exceeded before %s", deadline, next);
        return report.status(ReportStatus.TIMEOUT)
                .failureCause(cause)
                .warnings(warnings)
                .build();
    }

    private static void reportEvents(Report.ReportBuilder report, List<ParsedEvent> events, Integer limit) {
        if (limit != null && events.size() > limit) {
            report.events(events.subList(0, limit));
            report.eventsTruncated(true);
        } else {
            report.events(events);
        }
    }

    private static List<String> parseWarnings(List<ParseResult> results) {
        List<String> warnings = new ArrayList<>();
        List<ParseResult> unmatched = new ArrayList<>();
        List<ParseResult> inferred = new ArrayList<>();
        List<ParseResult> degraded = new ArrayList<>();
        for (ParseResult result : results) {
            if (result.isUnmatched()) {
                unmatched.add(result);
            } else if (result.isDegraded()) {
                degraded.add(result);
            } else if (result.isTimestampInferred()) {
                inferred.add(result);
            }
        }

        if (!unmatched.isEmpty()) {
            warnings.add(String.format("%d line(s) matched no pattern rule (first at %s)",
                    unmatched.size(), unmatched.get(0).getEvent().getReference()));
        }
        if (!inferred.isEmpty()) {
            warnings.add(String.format("%d event(s) use the ingestion time as timestamp (first at %s)",
                    inferred.size(), inferred.get(0).getEvent().getReference()));
        }
        for (int i = 0; i < degraded.size() && i < MAX_DETAILED_WARNINGS; i++) {
            warnings.add("Degraded extraction: " + degraded.get(i).getErrorMessage());
        }
        if (degraded.size() > MAX_DETAILED_WARNINGS) {
            warnings.add(String.format("%d more line(s) with degraded extraction",
                    degraded.size() - MAX_DETAILED_WARNINGS));
        }
        return warnings;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
