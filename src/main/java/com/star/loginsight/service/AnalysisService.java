package com.star.loginsight.service;

import com.star.loginsight.config.InsightProperties;
import com.star.loginsight.detection.BaselineLookup;
import com.star.loginsight.dto.AnalysisRequest;
import com.star.loginsight.dto.LogSourceRequest;
import com.star.loginsight.dto.PatternRuleRequest;
import com.star.loginsight.dto.ThresholdRequest;
import com.star.loginsight.exception.LogReadException;
import com.star.loginsight.model.LogLine;
import com.star.loginsight.model.Report;
import com.star.loginsight.model.ReportStatus;
import com.star.loginsight.model.ThresholdConfig;
import com.star.loginsight.parser.PatternRule;
import com.star.loginsight.pipeline.AnalysisOptions;
import com.star.loginsight.pipeline.AnalysisPipeline;
import com.star.loginsight.processor.LogLineReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adapts REST input into pipeline runs: builds the log lines, merges per-request
 * overrides onto the configured options and supplies the baseline snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisService {

    private final AnalysisPipeline analysisPipeline;
    private final BaselineService baselineService;
    private final InsightProperties insightProperties;
    private final LogLineReader logLineReader;
    private final Clock clock;

    public Report analyze(AnalysisRequest request) {
        Instant ingestedAt = clock.instant();
        List<LogLine> lines = new ArrayList<>();
        for (LogSourceRequest source : request.getSources()) {
            long lineNumber = 0;
            for (String text : source.getLines()) {
                lines.add(LogLine.of(source.getSourceId(), ++lineNumber, text, ingestedAt));
            }
        }

        log.info("Analyzing {} lines from {} sources", lines.size(), request.getSources().size());
        return run(lines, options(request), List.of());
    }

    public Report analyzeFile(MultipartFile logfile, String sourceId) {
        log.info("Analyzing uploaded file {} ({} bytes) as source {}",
                logfile.getOriginalFilename(), logfile.getSize(), sourceId);

        LogLineReader.ReadResult read;
        try (InputStream in = logfile.getInputStream()) {
            read = logLineReader.read(in, sourceId);
        } catch (IOException e) {
            throw new LogReadException("Failed to read uploaded file: " + e.getMessage(), e);
        }

        List<String> warnings = new ArrayList<>();
        long truncated = read.getStats().getTruncatedLines();
        if (truncated > 0) {
            warnings.add(String.format("%d line(s) of %s were cut to the maximum line length", truncated, sourceId));
        }
        return run(read.getLines(), insightProperties.toOptions(), warnings);
    }

    public List<PatternRule> activeRules() {
        return insightProperties.toPatternRules();
    }

    private Report run(List<LogLine> lines, AnalysisOptions options, List<String> readWarnings) {
        List<String> warnings = new ArrayList<>(readWarnings);
        BaselineLookup baseline;
        try {
            baseline = baselineService.snapshot();
        } catch (RuntimeException e) {
            log.warn("Baseline store unavailable, continuing without baselines: {}", e.getMessage());
            warnings.add("Baseline store unavailable (" + e.getMessage() + "); every dimension treated as missing");
            baseline = BaselineLookup.empty();
        }

        Report report = analysisPipeline.run(lines, baseline, options);
        if (warnings.isEmpty()) {
            return report;
        }
        ReportStatus status = report.getStatus() == ReportStatus.OK ? ReportStatus.PARTIAL : report.getStatus();
        return report.toBuilder()
                .status(status)
                .warnings(warnings)
                .build();
    }

    private AnalysisOptions options(AnalysisRequest request) {
        AnalysisOptions.AnalysisOptionsBuilder options = insightProperties.toOptions().toBuilder();
        if (request.getWindowSize() != null) {
            options.windowSize(request.getWindowSize());
        }
        if (request.getCorrelationWindow() != null) {
            options.correlationWindow(request.getCorrelationWindow());
        }
        if (request.getEventLimit() != null) {
            options.eventLimit(request.getEventLimit());
        }
        if (request.getThresholds() != null) {
            options.thresholds(merge(insightProperties.toThresholdConfig(), request.getThresholds()));
        }
        if (request.getRules() != null && !request.getRules().isEmpty()) {
            List<PatternRule> rules = new ArrayList<>();
            for (PatternRuleRequest rule : request.getRules()) {
                rules.add(PatternRule.builder()
                        .id(rule.getId())
                        .regex(rule.getRegex())
                        .fields(rule.getFields() != null ? rule.getFields() : Map.of())
                        .timestampFormat(rule.getTimestampFormat())
                        .build());
            }
            options.rules(rules);
        }
        return options.build();
    }

    private static ThresholdConfig merge(ThresholdConfig configured, ThresholdRequest overrides) {
        ThresholdConfig.ThresholdConfigBuilder thresholds = configured.toBuilder();
        if (overrides.getMedium() != null) {
            thresholds.medium(overrides.getMedium());
        }
        if (overrides.getHigh() != null) {
            thresholds.high(overrides.getHigh());
        }
        if (overrides.getEpsilon() != null) {
            thresholds.epsilon(overrides.getEpsilon());
        }
        if (overrides.getEvidenceCap() != null) {
            thresholds.evidenceCap(overrides.getEvidenceCap());
        }
        return thresholds.build();
    }
}
