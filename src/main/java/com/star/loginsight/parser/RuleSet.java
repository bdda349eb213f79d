package com.star.loginsight.parser;

import com.star.loginsight.exception.ConfigException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validated, compiled and ordered pattern rules. Evaluation order is the
 * configured order; the first rule whose regex matches the line wins.
 */
@Slf4j
public final class RuleSet {

    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private static final Set<String> SINGLE_VALUED_TARGETS = Set.of(
            PatternRule.TIMESTAMP,
            PatternRule.SERVICE,
            PatternRule.SEVERITY,
            PatternRule.MESSAGE,
            PatternRule.ERROR_SIGNATURE
    );

    @Getter
    private final List<CompiledRule> rules;

    private RuleSet(List<CompiledRule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    /**
     * Compiles the rules in order.
     *
     * @throws ConfigException carrying the id of the first malformed rule
     */
    public static RuleSet compile(List<PatternRule> patternRules) {
        if (patternRules == null) {
            throw ConfigException.invalidField("rules", null, "pattern rule list is required");
        }

        List<CompiledRule> compiled = new ArrayList<>(patternRules.size());
        Set<String> seenIds = new HashSet<>();

        for (PatternRule rule : patternRules) {
            if (rule == null) {
                throw ConfigException.invalidField("rules", null, "rule entries must not be null");
            }
            String id = rule.getId();
            if (id.isBlank()) {
                throw ConfigException.invalidRule(id, "id must not be blank");
            }
            if (!seenIds.add(id)) {
                throw ConfigException.invalidRule(id, "duplicate rule id");
            }
            compiled.add(compileRule(rule));
        }

        log.debug("Compiled {} pattern rules: {}", compiled.size(), seenIds);
        return new RuleSet(compiled);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    private static CompiledRule compileRule(PatternRule rule) {
        String id = rule.getId();
        Pattern pattern;
        try {
            pattern = Pattern.compile(rule.getRegex());
        } catch (PatternSyntaxException e) {
            throw ConfigException.invalidRegex(id, e);
        }

        Set<String> namedGroups = namedGroups(rule.getRegex());
        int groupCount = pattern.matcher("").groupCount();

        Map<String, String> fields = new LinkedHashMap<>();
        Set<String> claimedTargets = new HashSet<>();
        for (Map.Entry<String, String> entry : rule.getFields().entrySet()) {
            String group = entry.getKey();
            String target = entry.getValue() != null
                    ? entry.getValue().trim().toLowerCase(Locale.ROOT)
                    : "";

            if (target.isEmpty()) {
                throw ConfigException.invalidRule(id, "group '" + group + "' has no target field");
            }
            if (!groupExists(group, namedGroups, groupCount)) {
                throw ConfigException.invalidRule(id, "capture group '" + group + "' is not defined in the regex");
            }
            if (SINGLE_VALUED_TARGETS.contains(target) && !claimedTargets.add(target)) {
                throw ConfigException.invalidRule(id, "field '" + target + "' is extracted by more than one group");
            }
            fields.put(group, target);
        }

        DateTimeFormatter formatter = null;
        if (rule.getTimestampFormat() != null && !rule.getTimestampFormat().isBlank()) {
            try {
                formatter = DateTimeFormatter.ofPattern(rule.getTimestampFormat(), Locale.ENGLISH);
            } catch (IllegalArgumentException e) {
                throw ConfigException.invalidRule(id, "invalid timestamp format '" + rule.getTimestampFormat() + "'");
            }
        }

        return new CompiledRule(id, pattern, Collections.unmodifiableMap(fields), formatter);
    }

    private static Set<String> namedGroups(String regex) {
        Set<String> names = new HashSet<>();
        Matcher matcher = NAMED_GROUP.matcher(regex);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static boolean groupExists(String group, Set<String> namedGroups, int groupCount) {
        if (group == null || group.isEmpty()) {
            return false;
        }
        if (group.chars().allMatch(Character::isDigit)) {
            try {
                int index = Integer.parseInt(group);
                return index >= 1 && index <= groupCount;
            } catch (NumberFormatException e) {
                return false;  // beyond int range, so never a real group
            }
        }
        return namedGroups.contains(group);
    }

    /**
     * A rule ready for matching.
     */
    @Getter
    public static final class CompiledRule {
        private final String id;
        private final Pattern pattern;
        private final Map<String, String> fields;
        private final DateTimeFormatter timestampFormatter;

        CompiledRule(String id, Pattern pattern, Map<String, String> fields, DateTimeFormatter timestampFormatter) {
            this.id = id;
            this.pattern = pattern;
            this.fields = fields;
            this.timestampFormatter = timestampFormatter;
        }

        String group(Matcher matcher, String group) {
            if (group.chars().allMatch(Character::isDigit)) {
                return matcher.group(Integer.parseInt(group));
            }
            return matcher.group(group);
        }
    }
}
