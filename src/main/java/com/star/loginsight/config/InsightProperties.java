package com.star.loginsight.config;

import com.star.loginsight.aggregation.Aggregator;
import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.model.DimensionSpec;
import com.star.loginsight.model.ThresholdConfig;
import com.star.loginsight.parser.DefaultPatternRules;
import com.star.loginsight.parser.EventParser;
import com.star.loginsight.parser.PatternRule;
import com.star.loginsight.parser.SignatureClassifier;
import com.star.loginsight.parser.SignatureRule;
import com.star.loginsight.pipeline.AnalysisOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings under {@code insight.*}. Empty rule or signature tables fall back to
 * the built-in defaults.
 */
@Data
@ConfigurationProperties(prefix = "insight")
public class InsightProperties {

    private Duration windowSize = AnalysisOptions.DEFAULT_WINDOW_SIZE;

    private Duration correlationWindow = AnalysisOptions.DEFAULT_CORRELATION_WINDOW;

    private Set<DimensionSpec> dimensions = EnumSet.copyOf(Aggregator.DEFAULT_DIMENSIONS);

    private Integer eventLimit = 10_000;

    private Duration timeout = Duration.ofSeconds(60);

    private String timeZone = "UTC";

    private Thresholds thresholds = new Thresholds();

    private Parser parser = new Parser();

    private List<Rule> rules = new ArrayList<>();

    private List<Signature> signatures = new ArrayList<>();

    @Data
    public static class Thresholds {
        private double medium = 2.0;
        private double high = 3.0;
        private double epsilon = 1e-6;
        private int evidenceCap = 5;
    }

    @Data
    public static class Parser {
        private int chunkSize = EventParser.DEFAULT_CHUNK_SIZE;
        private int workerThreads = 4;
        private int maxLineLength = EventParser.DEFAULT_MAX_LINE_LENGTH;
    }

    @Data
    public static class Rule {
        private String id;
        private String regex;
        private Map<String, String> fields = new LinkedHashMap<>();
        private String timestampFormat;
    }

    @Data
    public static class Signature {
        private String code;
        private String regex;
    }

    public ThresholdConfig toThresholdConfig() {
        return ThresholdConfig.builder()
                .medium(thresholds.getMedium())
                .high(thresholds.getHigh())
                .epsilon(thresholds.getEpsilon())
                .evidenceCap(thresholds.getEvidenceCap())
                .build();
    }

    public List<PatternRule> toPatternRules() {
        if (rules == null || rules.isEmpty()) {
            return DefaultPatternRules.rules();
        }
        List<PatternRule> patternRules = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            requireText("insight.rules[" + i + "].id", rule.getId());
            requireText("insight.rules[" + i + "].regex", rule.getRegex());
            patternRules.add(PatternRule.builder()
                    .id(rule.getId())
                    .regex(rule.getRegex())
                    .fields(rule.getFields() != null ? rule.getFields() : Map.of())
                    .timestampFormat(rule.getTimestampFormat())
                    .build());
        }
        return patternRules;
    }

    public List<SignatureRule> toSignatureRules() {
        if (signatures == null || signatures.isEmpty()) {
            return SignatureClassifier.defaultRules();
        }
        List<SignatureRule> signatureRules = new ArrayList<>(signatures.size());
        for (int i = 0; i < signatures.size(); i++) {
            Signature signature = signatures.get(i);
            requireText("insight.signatures[" + i + "].code", signature.getCode());
            requireText("insight.signatures[" + i + "].regex", signature.getRegex());
            signatureRules.add(SignatureRule.of(signature.getCode(), signature.getRegex()));
        }
        return signatureRules;
    }

    public AnalysisOptions toOptions() {
        return AnalysisOptions.builder()
                .rules(toPatternRules())
                .windowSize(windowSize)
                .correlationWindow(correlationWindow)
                .dimensions(dimensions)
                .thresholds(toThresholdConfig())
                .eventLimit(eventLimit)
                .timeout(timeout)
                .build();
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ConfigException.invalidField(field, value, "is required");
        }
    }
}
