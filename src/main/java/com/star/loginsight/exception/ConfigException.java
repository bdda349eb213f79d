package com.star.loginsight.exception;

import lombok.Getter;

/**
 * A malformed pattern rule or threshold setting. Fatal: raised before any line is
 * processed.
 */
@Getter
public class ConfigException extends AnalysisException {

    private final String ruleId;
    private final String field;
    private final Object invalidValue;

    public ConfigException(String ruleId, String field, Object invalidValue, String message) {
        super(message);
        this.ruleId = ruleId;
        this.field = field;
        this.invalidValue = invalidValue;
    }

    public ConfigException(String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
        this.field = null;
        this.invalidValue = null;
    }

    public static ConfigException invalidRule(String ruleId, String reason) {
        return new ConfigException(
                ruleId,
                null,
                null,
                String.format("Invalid pattern rule '%s': %s", ruleId, reason)
        );
    }

    public static ConfigException invalidRegex(String ruleId, Throwable cause) {
        return new ConfigException(
                ruleId,
                String.format("Invalid pattern rule '%s': regex does not compile (%s)", ruleId, cause.getMessage()),
                cause
        );
    }

    public static ConfigException invalidField(String field, Object value, String reason) {
        return new ConfigException(
                null,
                field,
                value,
                String.format("Invalid value '%s' for '%s': %s", value, field, reason)
        );
    }
}
