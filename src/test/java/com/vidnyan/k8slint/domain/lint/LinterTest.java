package com.vidnyan.k8slint.domain.lint;

import com.vidnyan.k8slint.adapter.out.rule.BuiltInRules;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.testsupport.GoSources;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LinterTest {

    private static final SourceFile FILE = GoSources.parse("package manifests\n");

    private static Rule fixedRule(String id, Severity severity) {
        return new Rule() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String name() {
                return id;
            }

            @Override
            public String description() {
                return "reports once per file";
            }

            @Override
            public Severity severity() {
                return severity;
            }

            @Override
            public List<Issue> check(SourceFile file) {
                return List.of(Issue.builder().ruleId(id).message(id + " found").file(file.path())
                        .severity(severity).build());
            }
        };
    }

    private static Rule brokenRule() {
        return new Rule() {
            @Override
            public String id() {
                return "WK9999";
            }

            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String description() {
                return "always throws";
            }

            @Override
            public Severity severity() {
                return Severity.ERROR;
            }

            @Override
            public List<Issue> check(SourceFile file) {
                throw new IllegalStateException("boom");
            }
        };
    }

    private final RuleRegistry registry = new RuleRegistry(List.of(
            fixedRule("WK0001", Severity.ERROR),
            fixedRule("WK0002", Severity.WARNING),
            fixedRule("WK0003", Severity.INFO)));

    @Test
    void check_ShouldReportEveryEnabledRuleInRegistryOrder() {
        List<Issue> issues = new Linter(registry, LintConfig.defaults()).check(FILE);

        assertEquals(List.of("WK0001", "WK0002", "WK0003"), issues.stream().map(Issue::ruleId).toList());
    }

    @Test
    void check_ShouldDropIssuesBelowTheSeverityThreshold() {
        Linter linter = new Linter(registry, LintConfig.defaults().withMinSeverity(Severity.WARNING));

        List<Issue> issues = linter.check(FILE);

        assertEquals(List.of("WK0001", "WK0002"), issues.stream().map(Issue::ruleId).toList());
    }

    @Test
    void check_ShouldNeverReportDisabledRules() {
        Linter linter = new Linter(registry, new LintConfig(Set.of("WK0002", "WK4242"), Severity.INFO));

        List<Issue> issues = linter.check(FILE);

        assertEquals(List.of("WK0001", "WK0003"), issues.stream().map(Issue::ruleId).toList());
        assertEquals(2, linter.rules().size());
    }

    @Test
    void check_ShouldSkipARuleThatThrows() {
        RuleRegistry withBroken = new RuleRegistry(List.of(brokenRule(), fixedRule("WK0001", Severity.ERROR)));

        List<Issue> issues = new Linter(withBroken, LintConfig.defaults()).check(FILE);

        assertEquals(1, issues.size());
        assertEquals("WK0001", issues.get(0).ruleId());
    }

    @Test
    void check_ShouldBeDeterministic() {
        Linter linter = new Linter(BuiltInRules.registry(), LintConfig.defaults());
        SourceFile file = GoSources.parse(GoSources.fixture("deep_nesting.go"));

        assertEquals(linter.check(file), linter.check(file));
    }

    @Test
    void check_ShouldReportAHardcodedPasswordOnce() {
        // Arrange
        SourceFile file = GoSources.parse("""
                package manifests

                var DbPassword = corev1.EnvVar{Name: "DB_PASSWORD", Value: "hardcoded-password"}
                """);

        // Act
        List<Issue> issues = new Linter(BuiltInRules.registry(), LintConfig.defaults()).check(file);

        // Assert
        assertEquals(1, issues.size(), issues.toString());
        assertEquals("WK8005", issues.get(0).ruleId());
        assertEquals(Severity.ERROR, issues.get(0).severity());
    }

    @Test
    void check_ShouldAcceptAPasswordFromASecretReference() {
        SourceFile file = GoSources.parse("""
                package manifests

                var DbPassword = corev1.EnvVar{
                    Name: "DB_PASSWORD",
                    ValueFrom: &corev1.EnvVarSource{
                        SecretKeyRef: &corev1.SecretKeySelector{Key: "password"},
                    },
                }
                """);

        List<Issue> issues = new Linter(BuiltInRules.registry(), LintConfig.defaults()).check(file);

        assertTrue(issues.isEmpty(), issues.toString());
    }
}
