package com.star.loginsight.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimestampParserTest {

    private static final Instant REFERENCE = Instant.parse("2024-06-01T00:00:00Z");

    private TimestampParser parser;

    @BeforeEach
    void setUp() {
        parser = new TimestampParser();
    }

    @ParameterizedTest
    @CsvSource({
            "2024-01-15T10:30:45Z, 2024-01-15T10:30:45Z",
            "2024-01-15T10:30:45.123+02:00, 2024-01-15T08:30:45.123Z",
            "2024-01-15T10:30:45+0100, 2024-01-15T09:30:45Z",
            "2024-01-15 10:30:45, 2024-01-15T10:30:45Z",
            "'2024-01-15 10:30:45,123', 2024-01-15T10:30:45.123Z",
            "2024/01/15 10:30:45, 2024-01-15T10:30:45Z",
            "15/Jan/2024:10:30:45 +0000, 2024-01-15T10:30:45Z",
            "'Jan 15, 2024 10:30:45', 2024-01-15T10:30:45Z",
            "1705314645, 2024-01-15T10:30:45Z",
            "1705314645123, 2024-01-15T10:30:45.123Z"
    })
    @DisplayName("Should parse supported formats")
    void shouldParseSupportedFormats(String text, String expected) {
        assertEquals(Optional.of(Instant.parse(expected)), parser.parse(text, null, REFERENCE));
    }

    @Test
    @DisplayName("Should take the year of year-less syslog timestamps from the reference")
    void shouldDefaultSyslogYear() {
        Optional<Instant> parsed = parser.parse("Jan  5 08:15:00", null, Instant.parse("2023-02-01T00:00:00Z"));

        assertEquals(Optional.of(Instant.parse("2023-01-05T08:15:00Z")), parsed);
    }

    @Test
    @DisplayName("Should interpret zone-less timestamps in the configured zone")
    void shouldUseConfiguredZone() {
        TimestampParser berlin = new TimestampParser(ZoneId.of("Europe/Berlin"));

        assertEquals(Optional.of(Instant.parse("2024-01-15T09:30:45Z")),
                berlin.parse("2024-01-15 10:30:45", null, REFERENCE));
    }

    @Test
    @DisplayName("Should try the custom formatter first")
    void shouldUseCustomFormatter() {
        DateTimeFormatter custom = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss");

        assertEquals(Optional.of(Instant.parse("2024-01-15T10:30:45Z")),
                parser.parse("15.01.2024 10:30:45", custom, REFERENCE));
    }

    @Test
    @DisplayName("Should fall back to auto-detection when the custom formatter fails")
    void shouldFallBackFromCustomFormatter() {
        DateTimeFormatter custom = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss");

        assertEquals(Optional.of(Instant.parse("2024-01-15T10:30:45Z")),
                parser.parse("2024-01-15T10:30:45Z", custom, REFERENCE));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a date", "2024-13-45 99:99:99", "12345"})
    @DisplayName("Should return empty for unparseable text")
    void shouldReturnEmptyForGarbage(String text) {
        assertTrue(parser.parse(text, null, REFERENCE).isEmpty());
    }

    @Test
    @DisplayName("Should return empty for null text")
    void shouldReturnEmptyForNull() {
        assertTrue(parser.parse(null, null, REFERENCE).isEmpty());
    }
}
