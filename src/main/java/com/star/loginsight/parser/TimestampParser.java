package com.star.loginsight.parser;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns timestamp text into an {@link Instant}. Zone-less values are read in the
 * configured zone; year-less syslog values borrow the year of the reference
 * instant.
 */
@Slf4j
public class TimestampParser {

    private static final Pattern EPOCH_SECONDS = Pattern.compile("^\\d{10}$");
    private static final Pattern EPOCH_MILLIS = Pattern.compile("^\\d{13}$");
    private static final Pattern SPACE_SEPARATED_ISO = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:)");
    private static final Pattern COMMA_FRACTION = Pattern.compile("(:\\d{2}),(\\d)");

    private static final DateTimeFormatter ISO_COMPACT_OFFSET = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HHmm", "Z")
            .toFormatter(Locale.ENGLISH);

    private static final List<DateTimeFormatter> ZONED_FORMATTERS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            ISO_COMPACT_OFFSET,
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH)
    );

    private static final List<DateTimeFormatter> LOCAL_FORMATTERS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss[.SSS]", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy HH:mm:ss", Locale.ENGLISH)
    );

    private final ZoneId zone;

    public TimestampParser() {
        this(ZoneOffset.UTC);
    }

    public TimestampParser(ZoneId zone) {
        this.zone = zone != null ? zone : ZoneOffset.UTC;
    }

    /**
     * @param text      timestamp text as captured from the line
     * @param custom    rule-specific formatter, tried first; may be {@code null}
     * @param reference supplies the year for year-less formats
     * @return the parsed instant, or empty when no known format fits
     */
    public Optional<Instant> parse(String text, DateTimeFormatter custom, Instant reference) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String value = text.trim().replaceAll("\\s+", " ");

        if (custom != null) {
            Optional<Instant> parsed = parseWith(custom, value);
            if (parsed.isPresent()) {
                return parsed;
            }
            log.debug("Custom format failed for '{}', trying auto-detection", value);
        }

        if (EPOCH_MILLIS.matcher(value).matches()) {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        }
        if (EPOCH_SECONDS.matcher(value).matches()) {
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(value)));
        }

        String iso = COMMA_FRACTION.matcher(SPACE_SEPARATED_ISO.matcher(value).replaceFirst("$1T$2"))
                .replaceFirst("$1.$2");

        for (DateTimeFormatter formatter : ZONED_FORMATTERS) {
            try {
                return Optional.of(OffsetDateTime.parse(iso, formatter).toInstant());
            } catch (DateTimeParseException e) {
                // next
            }
        }

        for (DateTimeFormatter formatter : LOCAL_FORMATTERS) {
            try {
                return Optional.of(LocalDateTime.parse(iso, formatter).atZone(zone).toInstant());
            } catch (DateTimeParseException e) {
                // next
            }
        }

        Optional<Instant> syslog = parseSyslog(value, reference);
        if (syslog.isEmpty()) {
            log.debug("Could not parse timestamp '{}'", value);
        }
        return syslog;
    }

    private Optional<Instant> parseWith(DateTimeFormatter formatter, String value) {
        try {
            TemporalAccessor parsed = formatter.parseBest(value,
                    ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return Optional.of(((ZonedDateTime) parsed).toInstant());
            }
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).atZone(zone).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseSyslog(String value, Instant reference) {
        int year = (reference != null ? reference : Instant.EPOCH).atZone(zone).getYear();
        DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern("MMM d HH:mm:ss")
                .parseDefaulting(ChronoField.YEAR, year)
                .toFormatter(Locale.ENGLISH);
        try {
            return Optional.of(LocalDateTime.parse(value, formatter).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
