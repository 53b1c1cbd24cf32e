package com.vidnyan.k8slint.domain.lint;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Which rules run and which issues are kept. Unknown rule IDs are ignored.
 */
public record LintConfig(Set<String> disabledRules, Severity minSeverity) {

    public LintConfig {
        disabledRules = disabledRules == null ? Set.of() : Set.copyOf(disabledRules);
        minSeverity = minSeverity == null ? Severity.INFO : minSeverity;
    }

    public static LintConfig defaults() {
        return new LintConfig(Set.of(), Severity.INFO);
    }

    public LintConfig withDisabledRule(String ruleId) {
        return withDisabledRules(Set.of(ruleId));
    }

    public LintConfig withDisabledRules(Collection<String> ruleIds) {
        Set<String> merged = new HashSet<>(disabledRules);
        merged.addAll(ruleIds);
        return new LintConfig(merged, minSeverity);
    }

    public LintConfig withMinSeverity(Severity severity) {
        return new LintConfig(disabledRules, severity);
    }

    public boolean isEnabled(Rule rule) {
        return !disabledRules.contains(rule.id());
    }

    public boolean admits(Severity severity) {
        return severity.isWithin(minSeverity);
    }
}
