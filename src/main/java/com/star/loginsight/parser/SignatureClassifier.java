package com.star.loginsight.parser;

import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Derives an error signature from the message of an error-level event. Rules are
 * tried in order and the first hit wins; error events matching nothing are
 * {@value #GENERIC_ERROR}. Events below ERROR carry no signature.
 */
public class SignatureClassifier {

    public static final String GENERIC_ERROR = "GENERIC_ERROR";

    private static final List<SignatureRule> DEFAULT_RULES = List.of(
            SignatureRule.of("DB_TIMEOUT", "\\b(?:database|db)\\b.*\\b(?:timeout|timed out)"),
            SignatureRule.of("CONNECTION_REFUSED", "connection (?:refused|reset)"),
            SignatureRule.of("TIMEOUT", "timeout|timed out|deadline exceeded"),
            SignatureRule.of("AUTH_FAILED", "auth(?:entication)?\\s+fail|unauthori[sz]ed|invalid credentials"),
            SignatureRule.of("RATE_LIMIT", "rate.?limit|too many requests"),
            SignatureRule.of("OOM", "out of memory|outofmemoryerror|\\boom\\b|memory error"),
            SignatureRule.of("NULL_POINTER", "null ?pointer|\\bnpe\\b"),
            SignatureRule.of("FORBIDDEN", "forbidden|access denied|permission denied"),
            SignatureRule.of("NOT_FOUND", "not found|\\b404\\b|missing resource"),
            SignatureRule.of("VALIDATION_ERROR", "validation|invalid input|bad request")
    );

    private final List<Compiled> rules;

    public SignatureClassifier() {
        this(DEFAULT_RULES);
    }

    /**
     * @throws ConfigException when a rule has a blank code or a broken regex
     */
    public SignatureClassifier(List<SignatureRule> signatureRules) {
        List<Compiled> compiled = new ArrayList<>(signatureRules.size());
        for (SignatureRule rule : signatureRules) {
            if (rule.getCode().isBlank()) {
                throw ConfigException.invalidField("signatures.code", rule.getCode(), "must not be blank");
            }
            try {
                compiled.add(new Compiled(
                        rule.getCode().trim().toUpperCase(Locale.ROOT),
                        Pattern.compile(rule.getRegex(), Pattern.CASE_INSENSITIVE)));
            } catch (PatternSyntaxException e) {
                throw ConfigException.invalidRegex(rule.getCode(), e);
            }
        }
        this.rules = Collections.unmodifiableList(compiled);
    }

    public static List<SignatureRule> defaultRules() {
        return DEFAULT_RULES;
    }

    public String classify(String message, Severity severity) {
        if (severity == null || !severity.isError()) {
            return null;
        }
        if (message != null) {
            for (Compiled rule : rules) {
                if (rule.pattern.matcher(message).find()) {
                    return rule.code;
                }
            }
        }
        return GENERIC_ERROR;
    }

    private static final class Compiled {
        final String code;
        final Pattern pattern;

        Compiled(String code, Pattern pattern) {
            this.code = code;
            this.pattern = pattern;
        }
    }
}
