package com.star.loginsight.processor;

import com.star.loginsight.exception.LogReadException;
import com.star.loginsight.model.LogLine;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Streams a log source into {@link LogLine}s. Line numbers start at 1 and blank
 * lines are kept, so every physical line yields one LogLine. All lines of one
 * read share the same ingestion time.
 */
@Slf4j
public class LogLineReader {

    private static final int DEFAULT_BUFFER_SIZE = 8 * 1024; // 8KB
    private static final int DEFAULT_MAX_LINE_LENGTH = 100_000;
    private static final long DEFAULT_MAX_LINES = 1_000_000;
    private static final char BOM = '\uFEFF';

    private final int bufferSize;
    private final Charset charset;
    private final int maxLineLength;
    private final long maxLines;
    private final Clock clock;

    @Getter
    public static class ReadStats {
        private long totalLines;
        private long bytesRead;
        private long truncatedLines;
        private long readTimeMs;

        public double getLinesPerSecond() {
            return readTimeMs > 0 ? (totalLines * 1000.0) / readTimeMs : 0;
        }

        @Override
        public String toString() {
            return String.format(
                    "ReadStats{lines=%d, bytes=%d, truncated=%d, timeMs=%d}",
                    totalLines, bytesRead, truncatedLines, readTimeMs);
        }
    }

    @Getter
    public static class ReadResult {
        private final List<LogLine> lines;
        private final ReadStats stats;

        ReadResult(List<LogLine> lines, ReadStats stats) {
            this.lines = Collections.unmodifiableList(lines);
            this.stats = stats;
        }
    }

    private LogLineReader(Builder builder) {
        this.bufferSize = builder.bufferSize;
        this.charset = builder.charset;
        this.maxLineLength = builder.maxLineLength;
        this.maxLines = builder.maxLines;
        this.clock = builder.clock;
    }

    public ReadResult read(Path filePath, String sourceId) {
        if (!Files.isReadable(filePath)) {
            throw new LogReadException("File not found or not readable: " + filePath);
        }
        try (InputStream in = Files.newInputStream(filePath)) {
            return read(in, sourceId);
        } catch (IOException e) {
            throw new LogReadException("Failed to read " + filePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads the whole stream. The stream is not closed.
     *
     * @throws LogReadException if the stream fails or holds more than the allowed number of lines
     */
    public ReadResult read(InputStream in, String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new LogReadException("Source id is required");
        }

        ReadStats stats = new ReadStats();
        List<LogLine> lines = new ArrayList<>();
        Instant ingestedAt = clock.instant();
        long startTime = clock.millis();
        long lineNumber = 0;

        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, charset), bufferSize);
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber > maxLines) {
                    throw new LogReadException(String.format(
                            "Source '%s' exceeds the limit of %d lines", sourceId, maxLines));
                }
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BOM) {
                    line = line.substring(1);
                }
                stats.bytesRead += line.length() + 1; // +1 for newline
                if (line.length() > maxLineLength) {
                    log.debug("Line {} of {} truncated from {} characters", lineNumber, sourceId, line.length());
                    line = line.substring(0, maxLineLength);
                    stats.truncatedLines++;
                }
                lines.add(LogLine.of(sourceId, lineNumber, line, ingestedAt));
            }
        } catch (IOException e) {
            throw new LogReadException(String.format(
                    "Failed to read source '%s' at line %d: %s", sourceId, lineNumber + 1, e.getMessage()), e);
        }

        stats.totalLines = lines.size();
        stats.readTimeMs = clock.millis() - startTime;

        log.info("Read {} lines from {} in {} ms ({} lines/sec)",
                stats.totalLines, sourceId, stats.readTimeMs,
                String.format("%.2f", stats.getLinesPerSecond()));

        return new ReadResult(lines, stats);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LogLineReader createDefault() {
        return builder().build();
    }

    public static class Builder {
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private Charset charset = StandardCharsets.UTF_8;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private long maxLines = DEFAULT_MAX_LINES;
        private Clock clock = Clock.systemUTC();

        public Builder bufferSize(int bufferSize) {
            if (bufferSize < 1024) {
                throw new IllegalArgumentException("Buffer size must be at least 1024 bytes");
            }
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset != null ? charset : StandardCharsets.UTF_8;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            if (maxLineLength < 1) {
                throw new IllegalArgumentException("Max line length must be at least 1");
            }
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder maxLines(long maxLines) {
            if (maxLines < 1) {
                throw new IllegalArgumentException("Max lines must be at least 1");
            }
            this.maxLines = maxLines;
            return this;
        }

        // Source of the ingestion time stamped on every line.
        public Builder clock(Clock clock) {
            this.clock = clock != null ? clock : Clock.systemUTC();
            return this;
        }

        public LogLineReader build() {
            return new LogLineReader(this);
        }
    }
}
