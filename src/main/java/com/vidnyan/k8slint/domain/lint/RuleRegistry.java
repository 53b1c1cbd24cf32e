package com.vidnyan.k8slint.domain.lint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered catalogue of rules, built once and shared by the engines.
 */
public final class RuleRegistry {

    private final Map<String, Rule> rules;

    public RuleRegistry(List<? extends Rule> rules) {
        Map<String, Rule> byId = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (byId.putIfAbsent(rule.id(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
        this.rules = Collections.unmodifiableMap(byId);
    }

    public List<Rule> allRules() {
        return List.copyOf(rules.values());
    }

    public Optional<Rule> find(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    /**
     * Rules left after removing the disabled ones, in catalogue order.
     */
    public List<Rule> enabled(LintConfig config) {
        return rules.values().stream().filter(config::isEnabled).toList();
    }

    /**
     * IDs of every rule that declares a fix, whether or not it is enabled.
     */
    public List<String> fixableRuleIds() {
        List<String> ids = new ArrayList<>();
        rules.values().stream().filter(rule -> rule.fix().isPresent()).forEach(rule -> ids.add(rule.id()));
        return ids;
    }

    public boolean isFixable(String ruleId) {
        return find(ruleId).flatMap(Rule::fix).isPresent();
    }

    public int size() {
        return rules.size();
    }
}
