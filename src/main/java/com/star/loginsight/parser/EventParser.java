package com.star.loginsight.parser;

import com.star.loginsight.exception.RecoverableParseException;
import com.star.loginsight.model.LogLine;
import com.star.loginsight.model.ParsedEvent;
import com.star.loginsight.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts raw {@link LogLine}s into {@link ParsedEvent}s using an ordered
 * {@link RuleSet}.
 *
 * <p>Parsing is total: each input line yields exactly one event, in input order.
 * The first rule whose regex matches the whole line wins. Lines no rule matches
 * become {@link Severity#UNKNOWN} events without a pattern id. When a timestamp
 * cannot be extracted the ingestion time is used and the event is flagged.
 *
 * <p>With an executor configured, inputs larger than one chunk are parsed in
 * parallel and reassembled by chunk index, so the output is identical to a
 * sequential run.
 */
@Slf4j
public class EventParser {

    public static final int DEFAULT_CHUNK_SIZE = 2_000;

    public static final int DEFAULT_MAX_LINE_LENGTH = 100_000;

    private static final Pattern LATENCY_PATTERN = Pattern.compile("(\\d+)\\s*ms\\b");

    private static final Pattern ERROR_CODE_PATTERN = Pattern.compile("\\bE\\d{4}\\b");

    private static final Pattern PERCENTAGE_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)%");

    private final TimestampParser timestampParser;
    private final SignatureClassifier signatureClassifier;
    private final Executor executor;
    private final int chunkSize;
    private final int maxLineLength;

    private EventParser(Builder builder) {
        this.timestampParser = builder.timestampParser;
        this.signatureClassifier = builder.signatureClassifier;
        this.executor = builder.executor;
        this.chunkSize = builder.chunkSize;
        this.maxLineLength = builder.maxLineLength;
    }

    /**
     * Compiles {@code rules} and parses every line.
     *
     * @throws com.star.loginsight.exception.ConfigException if a rule is malformed
     */
    public List<ParsedEvent> parse(List<LogLine> lines, List<PatternRule> rules) {
        return parseAll(lines, RuleSet.compile(rules)).stream()
                .map(ParseResult::getEvent)
                .collect(Collectors.toList());
    }

    public List<ParseResult> parseAll(List<LogLine> lines, RuleSet rules) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }

        if (executor == null || lines.size() <= chunkSize) {
            return parseChunk(lines, rules);
        }

        List<CompletableFuture<List<ParseResult>>> chunks = new ArrayList<>();
        for (int from = 0; from < lines.size(); from += chunkSize) {
            List<LogLine> chunk = lines.subList(from, Math.min(from + chunkSize, lines.size()));
            chunks.add(CompletableFuture.supplyAsync(() -> parseChunk(chunk, rules), executor));
        }

        log.debug("Parsing {} lines in {} chunks", lines.size(), chunks.size());

        List<ParseResult> results = new ArrayList<>(lines.size());
        for (CompletableFuture<List<ParseResult>> chunk : chunks) {
            results.addAll(chunk.join());
        }
        return results;
    }

    private List<ParseResult> parseChunk(List<LogLine> lines, RuleSet rules) {
        List<ParseResult> results = new ArrayList<>(lines.size());
        for (LogLine line : lines) {
            results.add(parseLine(line, rules));
        }
        return results;
    }

    public ParseResult parseLine(LogLine line, RuleSet rules) {
        String text = line.getText();
        boolean truncated = text.length() > maxLineLength;
        String candidate = truncated ? text.substring(0, maxLineLength) : text;

        for (RuleSet.CompiledRule rule : rules.getRules()) {
            Matcher matcher = rule.getPattern().matcher(candidate);
            if (!matcher.matches()) {
                continue;
            }

            try {
                ParsedEvent event = extract(line, rule, matcher);
                if (truncated) {
                    return ParseResult.degraded(event, String.format(
                            "%s: line exceeds %d characters, matched on truncated prefix",
                            event.getReference(), maxLineLength));
                }
                return ParseResult.matched(event);
            } catch (RecoverableParseException e) {
                log.debug("Degraded parse: {}", e.getMessage());
                return ParseResult.degraded(rawEvent(line), e.getMessage());
            }
        }

        return ParseResult.unmatched(rawEvent(line));
    }

    private ParsedEvent extract(LogLine line, RuleSet.CompiledRule rule, Matcher matcher) {
        String timestampText = null;
        String service = null;
        String severityText = null;
        String message = null;
        String signature = null;
        Map<String, String> attributes = new TreeMap<>();

        try {
            for (Map.Entry<String, String> mapping : rule.getFields().entrySet()) {
                String value = rule.group(matcher, mapping.getKey());
                if (value == null) {
                    continue;
                }
                switch (mapping.getValue()) {
                    case PatternRule.TIMESTAMP:
                        timestampText = value;
                        break;
                    case PatternRule.SERVICE:
                        service = value.trim();
                        break;
                    case PatternRule.SEVERITY:
                        severityText = value;
                        break;
                    case PatternRule.MESSAGE:
                        message = value.trim();
                        break;
                    case PatternRule.ERROR_SIGNATURE:
                        signature = value.trim();
                        break;
                    default:
                        attributes.put(mapping.getValue(), value.trim());
                }
            }
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new RecoverableParseException(line.getSourceId(), line.getLineNumber(),
                    "rule '" + rule.getId() + "' failed to extract fields: " + e.getMessage(), e);
        }

        Optional<Instant> timestamp = timestampParser.parse(
                timestampText, rule.getTimestampFormatter(), line.getIngestedAt());
        Severity severity = Severity.normalize(severityText);
        String resolvedMessage = message != null ? message : line.getText();
        String resolvedSignature = signature != null && !signature.isEmpty()
                ? signature.toUpperCase(Locale.ROOT)
                : signatureClassifier.classify(resolvedMessage, severity);

        messageMetadata(resolvedMessage).forEach(attributes::putIfAbsent);

        return ParsedEvent.builder()
                .timestamp(timestamp.orElse(line.getIngestedAt()))
                .timestampInferred(timestamp.isEmpty())
                .service(resolveService(service, line))
                .severity(severity)
                .message(resolvedMessage)
                .errorSignature(resolvedSignature)
                .raw(line.getText())
                .sourcePatternId(rule.getId())
                .sourceId(line.getSourceId())
                .lineNumber(line.getLineNumber())
                .attributes(attributes)
                .build();
    }

    private ParsedEvent rawEvent(LogLine line) {
        return ParsedEvent.builder()
                .timestamp(line.getIngestedAt())
                .timestampInferred(true)
                .service(resolveService(null, line))
                .severity(Severity.UNKNOWN)
                .message(line.getText())
                .raw(line.getText())
                .sourceId(line.getSourceId())
                .lineNumber(line.getLineNumber())
                .build();
    }

    // Extracted service, else the source id, else "unknown".
    private String resolveService(String extracted, LogLine line) {
        if (extracted != null && !extracted.isEmpty()) {
            return extracted;
        }
        if (!line.getSourceId().isBlank()) {
            return line.getSourceId();
        }
        return ParsedEvent.UNKNOWN_SERVICE;
    }

    private Map<String, String> messageMetadata(String message) {
        Map<String, String> metadata = new TreeMap<>();

        Matcher latency = LATENCY_PATTERN.matcher(message);
        if (latency.find()) {
            metadata.put("latency_ms", latency.group(1));
        }

        Matcher errorCode = ERROR_CODE_PATTERN.matcher(message);
        if (errorCode.find()) {
            metadata.put("error_code", errorCode.group());
        }

        Matcher percentage = PERCENTAGE_PATTERN.matcher(message);
        if (percentage.find()) {
            metadata.put("percentage", percentage.group(1));
        }

        return metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EventParser createDefault() {
        return builder().build();
    }

    public static class Builder {
        private TimestampParser timestampParser = new TimestampParser();
        private SignatureClassifier signatureClassifier = new SignatureClassifier();
        private Executor executor;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

        public Builder timestampParser(TimestampParser timestampParser) {
            this.timestampParser = timestampParser != null ? timestampParser : new TimestampParser();
            return this;
        }

        public Builder signatureClassifier(SignatureClassifier signatureClassifier) {
            this.signatureClassifier = signatureClassifier != null ? signatureClassifier : new SignatureClassifier();
            return this;
        }

        // Worker pool for large inputs; null parses on the calling thread.
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            if (chunkSize < 1) {
                throw new IllegalArgumentException("Chunk size must be at least 1");
            }
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            if (maxLineLength < 1) {
                throw new IllegalArgumentException("Max line length must be at least 1");
            }
            this.maxLineLength = maxLineLength;
            return this;
        }

        public EventParser build() {
            return new EventParser(this);
        }
    }
}
