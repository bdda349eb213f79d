package com.star.loginsight.parser;

import java.util.List;

/**
 * Built-in rule table used when no rules are configured, ordered most specific
 * first.
 *
 * <ul>
 *   <li>Spring Boot: {@code 2024-01-15 10:30:45.123  INFO 1234 --- [main] c.e.Class : Message}</li>
 *   <li>Service tagged: {@code 2024-01-15T10:30:45Z ERROR [auth-service] Database timeout}</li>
 *   <li>Log4j/Logback: {@code 2024-01-15 10:30:45.123 [main] ERROR c.e.Class - Message}</li>
 *   <li>ISO: {@code 2024-01-15T10:30:45.123Z WARN: Disk almost full}</li>
 *   <li>Syslog: {@code Jan 15 10:30:45 hostname service[pid]: message}</li>
 *   <li>Bracketed: {@code [2024-01-15 10:30:45] INFO: Application started}</li>
 *   <li>Level only: {@code ERROR: something broke}</li>
 * </ul>
 */
public final class DefaultPatternRules {

    private static final String LEVEL =
            "(?<level>(?i:TRACE|DEBUG|INFO|NOTICE|WARN(?:ING)?|ERROR|SEVERE|FATAL|CRITICAL))";

    private static final String DATE_TIME =
            "(?<timestamp>\\d{4}-\\d{2}-\\d{2}[T\\s]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d{1,9})?(?:Z|[+-]\\d{2}:?\\d{2})?)";

    public static final PatternRule SPRING_BOOT = PatternRule.builder()
            .id("spring-boot")
            .regex("^" + DATE_TIME + "\\s+" + LEVEL + "\\s+(?:(?<pid>\\d+)\\s+)?---\\s+"
                    + "\\[\\s*(?<thread>[^\\]]+)\\]\\s+(?<logger>[\\w.$-]+)\\s*:\\s+(?<message>.*)$")
            .field("timestamp", PatternRule.TIMESTAMP)
            .field("level", PatternRule.SEVERITY)
            .field("message", PatternRule.MESSAGE)
            .field("thread", "thread")
            .field("logger", "logger")
            .field("pid", "pid")
            .build();

    public static final PatternRule SERVICE_TAGGED = PatternRule.builder()
            .id("service-tagged")
            .regex("^" + DATE_TIME + "\\s+" + LEVEL + "\\s*:?\\s+\\[(?<service>[\\w.-]+)\\]:?\\s+(?<message>.*)$")
            .field("timestamp", PatternRule.TIMESTAMP)
            .field("level", PatternRule.SEVERITY)
            .field("service", PatternRule.SERVICE)
            .field("message", PatternRule.MESSAGE)
            .build();

    public static final PatternRule LOG4J = PatternRule.builder()
            .id("log4j")
            .regex("^" + DATE_TIME + "\\s+\\[(?<thread>[^\\]]+)\\]\\s+" + LEVEL + "\\s+"
                    + "(?:(?<logger>[\\w.$-]+)\\s+[-:]\\s+)?(?<message>.*)$")
            .field("timestamp", PatternRule.TIMESTAMP)
            .field("level", PatternRule.SEVERITY)
            .field("message", PatternRule.MESSAGE)
            .field("thread", "thread")
            .field("logger", "logger")
            .build();

    public static final PatternRule ISO = PatternRule.builder()
            .id("iso")
            .regex("^" + DATE_TIME + "\\s+" + LEVEL + "\\s*:?\\s+(?<message>.*)$")
            .field("timestamp", PatternRule.TIMESTAMP)
            .field("level", PatternRule.SEVERITY)
            .field("message", PatternRule.MESSAGE)
            .build();

    public static final PatternRule SYSLOG = PatternRule.builder()
            .id("syslog")
            .regex("^(?<timestamp>[A-Z][a-z]{2}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2})\\s+"
                    + "(?<hostname>[\\w.-]+)\\s+(?<service>[\\w.-]+)(?:\\[(?<pid>\\d+)\\])?:\\s+(?<message>.*)$")
            .field("timestamp", PatternRule.TIMESTAMP)
            .field("service", PatternRule.SERVICE)
            .field("message", PatternRule.MESSAGE)
            .field("hostname", "hostname")
            .field("pid", "pid")
            .build();

    public static final PatternRule BRACKETED = PatternRule.builder()
            .id("bracketed")
            .regex("^\\[(?<timestamp>[^\\]]+)\\]\\s+" + LEVEL + "\\s*:?\\s+(?<message>.*)$")
            .field("timestamp", PatternRule.TIMESTAMP)
            .field("level", PatternRule.SEVERITY)
            .field("message", PatternRule.MESSAGE)
            .build();

    public static final PatternRule LEVEL_ONLY = PatternRule.builder()
            .id("level-only")
            .regex("^" + LEVEL + "\\s*:?\\s+(?<message>.*)$")
            .field("level", PatternRule.SEVERITY)
            .field("message", PatternRule.MESSAGE)
            .build();

    private static final List<PatternRule> DEFAULTS = List.of(
            SPRING_BOOT,
            SERVICE_TAGGED,
            LOG4J,
            ISO,
            SYSLOG,
            BRACKETED,
            LEVEL_ONLY
    );

    private DefaultPatternRules() {
    }

    public static List<PatternRule> rules() {
        return DEFAULTS;
    }
}
