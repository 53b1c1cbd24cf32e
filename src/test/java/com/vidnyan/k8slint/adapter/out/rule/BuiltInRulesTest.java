package com.vidnyan.k8slint.adapter.out.rule;

import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.LintConfig;
import com.vidnyan.k8slint.domain.lint.Linter;
import com.vidnyan.k8slint.domain.lint.Rule;
import com.vidnyan.k8slint.domain.lint.RuleRegistry;
import com.vidnyan.k8slint.testsupport.GoSources;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltInRulesTest {

    private final RuleRegistry registry = BuiltInRules.registry();

    @Test
    void registry_ShouldListAllRulesInCatalogueOrder() {
        List<String> ids = registry.allRules().stream().map(Rule::id).toList();

        assertEquals(List.of(
                "WK8001", "WK8002", "WK8003", "WK8004", "WK8005", "WK8006", "WK8041", "WK8042",
                "WK8101", "WK8102", "WK8103", "WK8104", "WK8105",
                "WK8201", "WK8202", "WK8203", "WK8204", "WK8205", "WK8207", "WK8208", "WK8209",
                "WK8301", "WK8302", "WK8303", "WK8304", "WK8401"), ids);
    }

    @Test
    void registry_ShouldExposeTheFixableRules() {
        assertEquals(List.of("WK8002", "WK8105"), registry.fixableRuleIds());
        assertTrue(registry.isFixable("WK8105"));
        assertFalse(registry.isFixable("WK8006"));
    }

    @Test
    void rules_ShouldDescribeThemselves() {
        for (Rule rule : registry.allRules()) {
            assertFalse(rule.name().isBlank(), rule.id());
            assertFalse(rule.description().isBlank(), rule.id());
            assertNotNull(rule.severity(), rule.id());
        }
    }

    @Test
    void cleanFixture_ShouldProduceNoIssues() {
        Linter linter = new Linter(registry, LintConfig.defaults());

        List<Issue> issues = linter.check(GoSources.parse("clean.go", GoSources.fixture("clean_deployment.go")));

        assertTrue(issues.isEmpty(), issues.toString());
    }
}
