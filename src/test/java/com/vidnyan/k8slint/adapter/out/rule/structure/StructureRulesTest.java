package com.vidnyan.k8slint.adapter.out.rule.structure;

import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Rule;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.testsupport.GoSources;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructureRulesTest {

    private static List<Issue> check(Rule rule, String source) {
        return rule.check(GoSources.parse(source));
    }

    @Test
    void directDeclaration_ShouldFlagFunctionCallInitializers() {
        List<Issue> issues = check(new DirectDeclarationRule(), """
                package manifests

                var Web = newDeployment("web")
                var Api = &builders.Deployment("api")
                var Size = int32(3)
                var Names = make([]string, 0)
                var Literal = appsv1.Deployment{Spec: defaultSpec()}
                """);

        assertEquals(2, issues.size());
        assertEquals("Web is initialized by a function call, declare it as a composite literal instead",
                issues.get(0).message());
        assertEquals(3, issues.get(0).line());
        assertEquals(11, issues.get(0).column());
        assertTrue(issues.get(1).message().startsWith("Api "));
        assertEquals(Severity.ERROR, issues.get(1).severity());
    }

    @Test
    void nestingDepth_ShouldFlagSixLevelsAndCiteTheDepth() {
        List<Issue> issues = check(new NestingDepthRule(), GoSources.fixture("deep_nesting.go"));

        assertEquals(1, issues.size());
        assertEquals("WK8002", issues.get(0).ruleId());
        assertEquals("Web has nesting depth 6 (max 5), extract nested structures into separate variables",
                issues.get(0).message());
        assertEquals(Severity.WARNING, issues.get(0).severity());
    }

    @Test
    void nestingDepth_ShouldAcceptTheSameValueSplitIntoVariables() {
        List<Issue> issues = check(new NestingDepthRule(), """
                package manifests

                var WebEnv = []corev1.EnvVar{{Name: "MODE", Value: "prod"}}
                var WebContainer = corev1.Container{Name: "web", Image: "nginx:1.21", Env: WebEnv}
                var WebPodSpec = corev1.PodSpec{Containers: []corev1.Container{WebContainer}}
                var Web = appsv1.Deployment{
                    Spec: appsv1.DeploymentSpec{
                        Template: corev1.PodTemplateSpec{Spec: WebPodSpec},
                    },
                }
                """);

        assertTrue(issues.isEmpty(), issues.toString());
    }

    @Test
    void duplicateResource_ShouldFlagSecondDeclarationOfSameIdentity() {
        List<Issue> issues = check(new DuplicateResourceRule(), """
                package manifests

                var First = corev1.Service{ObjectMeta: metav1.ObjectMeta{Name: "web"}}
                var Second = corev1.ConfigMap{ObjectMeta: metav1.ObjectMeta{Name: "web", Namespace: "default"}}
                var Third = corev1.Service{ObjectMeta: metav1.ObjectMeta{Name: "web", Namespace: "shop"}}
                var Fourth = &corev1.Service{ObjectMeta: metav1.ObjectMeta{Name: "web", Namespace: "shop"}}
                """);

        assertEquals(2, issues.size());
        assertEquals("Duplicate resource name \"web\" in namespace \"default\", already declared by First at line 3",
                issues.get(0).message());
        assertEquals(4, issues.get(0).line());
        assertEquals("Duplicate resource name \"web\" in namespace \"shop\", already declared by Third at line 5",
                issues.get(1).message());
    }

    @Test
    void circularReference_ShouldReportTheCycleChain() {
        List<Issue> issues = check(new CircularReferenceRule(), """
                package manifests

                var A = corev1.Service{ObjectMeta: metav1.ObjectMeta{Name: B.ObjectMeta.Name}}
                var B = corev1.Service{ObjectMeta: metav1.ObjectMeta{Name: A.ObjectMeta.Name}}
                """);

        assertEquals(1, issues.size());
        assertEquals("Circular dependency detected: A -> B -> A", issues.get(0).message());
        assertEquals(3, issues.get(0).line());
        assertEquals(5, issues.get(0).column());
    }

    @Test
    void circularReference_ShouldIgnoreOneWayReferences() {
        List<Issue> issues = check(new CircularReferenceRule(), """
                package manifests

                var A = corev1.Service{ObjectMeta: metav1.ObjectMeta{Name: "a"}}
                var B = corev1.Service{ObjectMeta: metav1.ObjectMeta{Name: A.ObjectMeta.Name}}
                """);

        assertTrue(issues.isEmpty());
    }
}
