package com.vidnyan.k8slint.domain.lint;

import com.vidnyan.k8slint.adapter.out.rule.BuiltInRules;
import com.vidnyan.k8slint.domain.ast.CallExpr;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Ident;
import com.vidnyan.k8slint.domain.ast.KeyValueExpr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.testsupport.GoSources;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FixerTest {

    private final RuleRegistry registry = BuiltInRules.registry();

    private static String container(String image) {
        return "package manifests\n\nvar Web = corev1.Container{Name: \"web\", Image: \"" + image + "\"}\n";
    }

    private static Rule fixingRule(String id, RuleFix fix) {
        return new Rule() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String name() {
                return "Custom";
            }

            @Override
            public String description() {
                return "Custom fix";
            }

            @Override
            public Severity severity() {
                return Severity.INFO;
            }

            @Override
            public List<Issue> check(SourceFile file) {
                return List.of();
            }

            @Override
            public Optional<RuleFix> fix() {
                return Optional.of(fix);
            }
        };
    }

    @ParameterizedTest
    @CsvSource({
            "nginx:1.21, IfNotPresent",
            "nginx:latest, Always",
            "nginx, Always",
            "nginx@sha256:abc123, IfNotPresent"
    })
    void fix_ShouldChoosePullPolicyFromTheImageTag(String image, String policy) {
        Fixer fixer = new Fixer(registry, LintConfig.defaults());

        Fixer.FixOutcome outcome = fixer.fix(GoSources.parse(container(image)));

        assertTrue(outcome.changed());
        assertEquals("package manifests\n\nvar Web = corev1.Container{Name: \"web\", Image: \"" + image
                + "\", ImagePullPolicy: \"" + policy + "\"}\n", outcome.rewrittenSource());
        assertEquals(1, outcome.results().size());
        assertEquals("WK8105", outcome.results().get(0).ruleId());
    }

    @Test
    void fix_ShouldBeIdempotent() {
        Fixer fixer = new Fixer(registry, LintConfig.defaults());
        String once = fixer.fix(GoSources.parse(GoSources.fixture("deep_nesting.go"))).rewrittenSource();

        Fixer.FixOutcome twice = fixer.fix(GoSources.parse(once));

        assertFalse(twice.changed());
        assertTrue(twice.results().isEmpty());
    }

    @Test
    void fix_ShouldLeaveACleanFileAlone() {
        Fixer.FixOutcome outcome = new Fixer(registry, LintConfig.defaults())
                .fix(GoSources.parse(GoSources.fixture("clean_deployment.go")));

        assertFalse(outcome.changed());
        assertNull(outcome.rewrittenSource());
    }

    @Test
    void fix_ShouldExtractDeeplyNestedLiteralsAheadOfTheVariable() {
        // Arrange
        Fixer fixer = new Fixer(registry, LintConfig.defaults().withDisabledRule("WK8105"));

        // Act
        Fixer.FixOutcome outcome = fixer.fix(GoSources.parse(GoSources.fixture("deep_nesting.go")));

        // Assert
        String fixed = outcome.rewrittenSource();
        assertNotNull(fixed);
        assertEquals("Extracted 2 nested structure(s) from Web at line 10",
                outcome.results().get(0).description());
        assertTrue(fixed.contains("var WebNested1 = corev1.Container{"), fixed);
        assertTrue(fixed.contains("var WebContainers2 = []corev1.Container{"), fixed);
        assertTrue(fixed.contains("Containers: WebContainers2"), fixed);
        assertTrue(fixed.indexOf("var WebNested1") < fixed.indexOf("var Web ="));
        assertTrue(fixed.indexOf("var WebNested1") < fixed.indexOf("// Web nests six literals deep"));

        List<Issue> remaining = new Linter(registry, LintConfig.defaults()).check(GoSources.parse(fixed));
        assertTrue(remaining.stream().noneMatch(issue -> issue.ruleId().equals("WK8002")), remaining.toString());
    }

    @Test
    void fix_ShouldSkipDisabledFixableRules() {
        Fixer fixer = new Fixer(registry, LintConfig.defaults().withDisabledRules(List.of("WK8002", "WK8105")));

        Fixer.FixOutcome outcome = fixer.fix(GoSources.parse(GoSources.fixture("deep_nesting.go")));

        assertTrue(fixer.ruleIds().isEmpty());
        assertFalse(outcome.changed());
    }

    @Test
    void fix_ShouldApplyRulesInRegistryOrder() {
        Fixer fixer = new Fixer(registry, LintConfig.defaults());

        Fixer.FixOutcome outcome = fixer.fix(GoSources.parse(GoSources.fixture("deep_nesting.go")));

        assertEquals(List.of("WK8002", "WK8105"), fixer.ruleIds());
        assertEquals(List.of("WK8002", "WK8105"),
                outcome.results().stream().map(FixResult::ruleId).toList());
        assertTrue(outcome.rewrittenSource().contains("ImagePullPolicy: \"IfNotPresent\""));
    }

    @Test
    void fix_ShouldReportAFixThatThrowsAsFailedAndKeepGoing() {
        // Arrange
        RuleFix broken = file -> {
            throw new IllegalStateException("unexpected node");
        };
        RuleRegistry custom = new RuleRegistry(List.of(
                fixingRule("WK9001", broken),
                registry.find("WK8105").orElseThrow()));

        // Act
        Fixer.FixOutcome outcome = new Fixer(custom, LintConfig.defaults())
                .fix(GoSources.parse(container("nginx:1.21")));

        // Assert
        assertEquals(2, outcome.results().size());
        FixResult failed = outcome.results().get(0);
        assertEquals("WK9001", failed.ruleId());
        assertFalse(failed.fixed());
        assertEquals("unexpected node", failed.error());
        assertTrue(outcome.results().get(1).fixed());
        assertTrue(outcome.changed());
        assertTrue(outcome.rewrittenSource().contains("ImagePullPolicy: \"IfNotPresent\""));
    }

    @Test
    void fix_ShouldMarkAppliedFixesFailedWhenTheTreeCannotBePrinted() {
        // Arrange
        RuleFix unprintable = file -> {
            CompositeLit web = (CompositeLit) file.topLevelVars().get(0).value();
            CallExpr spanless = new CallExpr(Ident.synthetic("args", null), List.of(), null);
            web.insertElement(web.elements().size(), KeyValueExpr.syntheticField("Args", spanless));
            return List.of(FixResult.applied(file.path(), "WK9002", "Added Args"));
        };
        Fixer fixer = new Fixer(new RuleRegistry(List.of(fixingRule("WK9002", unprintable))), LintConfig.defaults());

        // Act
        Fixer.FixOutcome outcome = fixer.fix(GoSources.parse(container("nginx:1.21")));

        // Assert
        assertFalse(outcome.changed());
        assertEquals(1, outcome.results().size());
        FixResult result = outcome.results().get(0);
        assertFalse(result.fixed());
        assertEquals("Added Args", result.description());
        assertNotNull(result.error());
    }
}
