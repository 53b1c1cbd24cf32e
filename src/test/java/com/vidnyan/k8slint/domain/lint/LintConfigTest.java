package com.vidnyan.k8slint.domain.lint;

import com.vidnyan.k8slint.adapter.out.rule.BuiltInRules;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LintConfigTest {

    @Test
    void defaults_ShouldEnableEveryRuleAndAdmitEverySeverity() {
        LintConfig config = LintConfig.defaults();

        assertTrue(config.disabledRules().isEmpty());
        assertEquals(Severity.INFO, config.minSeverity());
        assertTrue(config.admits(Severity.INFO));
    }

    @Test
    void constructor_ShouldFillInNullsAndCopyTheDisabledSet() {
        LintConfig config = new LintConfig(null, null);

        assertEquals(Set.of(), config.disabledRules());
        assertEquals(Severity.INFO, config.minSeverity());
    }

    @Test
    void withDisabledRules_ShouldKeepEarlierEntries() {
        LintConfig config = LintConfig.defaults()
                .withDisabledRule("WK8001")
                .withDisabledRules(List.of("WK8105", "NOPE"));

        assertEquals(Set.of("WK8001", "WK8105", "NOPE"), config.disabledRules());
    }

    @Test
    void enabled_ShouldIgnoreUnknownRuleIds() {
        RuleRegistry registry = BuiltInRules.registry();
        LintConfig config = LintConfig.defaults().withDisabledRules(List.of("WK8006", "WK0000"));

        List<Rule> enabled = registry.enabled(config);

        assertEquals(registry.size() - 1, enabled.size());
        assertTrue(enabled.stream().noneMatch(rule -> rule.id().equals("WK8006")));
    }
}
