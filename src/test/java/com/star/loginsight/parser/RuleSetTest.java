package com.star.loginsight.parser;

import com.star.loginsight.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RuleSetTest {

    private static PatternRule.PatternRuleBuilder rule(String id) {
        return PatternRule.builder()
                .id(id)
                .regex("^(?<level>\\w+): (?<message>.*)$")
                .field("level", PatternRule.SEVERITY)
                .field("message", PatternRule.MESSAGE);
    }

    @Test
    @DisplayName("Should compile rules in configured order")
    void shouldPreserveOrder() {
        RuleSet rules = RuleSet.compile(List.of(rule("b").build(), rule("a").build(), rule("c").build()));

        assertEquals(List.of("b", "a", "c"), rules.getRules().stream()
                .map(RuleSet.CompiledRule::getId)
                .collect(Collectors.toList()));
        assertEquals(3, rules.size());
    }

    @Test
    @DisplayName("Should compile the default rule table")
    void shouldCompileDefaults() {
        assertEquals(DefaultPatternRules.rules().size(), RuleSet.compile(DefaultPatternRules.rules()).size());
    }

    @Test
    @DisplayName("Should accept an empty rule list")
    void shouldAcceptEmptyList() {
        assertTrue(RuleSet.compile(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Should reject duplicate rule ids")
    void shouldRejectDuplicateIds() {
        ConfigException ex = assertThrows(ConfigException.class,
                () -> RuleSet.compile(List.of(rule("dup").build(), rule("dup").build())));

        assertEquals("dup", ex.getRuleId());
        assertTrue(ex.getMessage().contains("duplicate"));
    }

    @Test
    @DisplayName("Should reject a regex that does not compile")
    void shouldRejectBrokenRegex() {
        ConfigException ex = assertThrows(ConfigException.class,
                () -> RuleSet.compile(List.of(rule("ok").build(), rule("bad").regex("(?<level>\\w+").build())));

        assertEquals("bad", ex.getRuleId());
    }

    @Test
    @DisplayName("Should reject a mapping to an undefined capture group")
    void shouldRejectUndefinedGroup() {
        ConfigException ex = assertThrows(ConfigException.class,
                () -> RuleSet.compile(List.of(rule("missing").field("service", PatternRule.SERVICE).build())));

        assertEquals("missing", ex.getRuleId());
        assertTrue(ex.getMessage().contains("service"));
    }

    @Test
    @DisplayName("Should reject a numeric group beyond the group count")
    void shouldRejectNumericGroupOutOfRange() {
        PatternRule numeric = PatternRule.builder()
                .id("numeric")
                .regex("^(\\w+) (.*)$")
                .field("3", PatternRule.MESSAGE)
                .build();

        assertThrows(ConfigException.class, () -> RuleSet.compile(List.of(numeric)));
    }

    @Test
    @DisplayName("Should reject a numeric group too large for an index")
    void shouldRejectOversizedNumericGroup() {
        PatternRule oversized = PatternRule.builder()
                .id("bad-index")
                .regex("(.*)")
                .field("99999999999", PatternRule.MESSAGE)
                .build();

        ConfigException ex = assertThrows(ConfigException.class, () -> RuleSet.compile(List.of(oversized)));
        assertEquals("bad-index", ex.getRuleId());
        assertTrue(ex.getMessage().contains("99999999999"));
    }

    @Test
    @DisplayName("Should reject two groups extracting the same core field")
    void shouldRejectDuplicateTarget() {
        PatternRule twice = PatternRule.builder()
                .id("twice")
                .regex("^(?<a>\\w+) (?<b>.*)$")
                .field("a", PatternRule.MESSAGE)
                .field("b", PatternRule.MESSAGE)
                .build();

        ConfigException ex = assertThrows(ConfigException.class, () -> RuleSet.compile(List.of(twice)));
        assertEquals("twice", ex.getRuleId());
    }

    @Test
    @DisplayName("Should reject a blank target field")
    void shouldRejectBlankTarget() {
        assertThrows(ConfigException.class,
                () -> RuleSet.compile(List.of(rule("blank").field("level", " ").build())));
    }

    @Test
    @DisplayName("Should reject an invalid timestamp format")
    void shouldRejectInvalidTimestampFormat() {
        ConfigException ex = assertThrows(ConfigException.class,
                () -> RuleSet.compile(List.of(rule("fmt").timestampFormat("yyyy-MM-dd bbb").build())));

        assertEquals("fmt", ex.getRuleId());
    }

    @Test
    @DisplayName("Should reject a missing rule list and null entries")
    void shouldRejectNulls() {
        assertThrows(ConfigException.class, () -> RuleSet.compile(null));
        assertThrows(ConfigException.class, () -> RuleSet.compile(Arrays.asList(rule("a").build(), null)));
    }
}
