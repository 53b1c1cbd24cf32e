package com.vidnyan.k8slint.adapter.out.rule.availability;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A replicated deployment should be covered by a PodDisruptionBudget declared in the same
 * file. A budget covers a deployment when its non-empty selector is contained in the
 * deployment's selector labels. A deployment whose selector labels cannot be read as a
 * literal map is not reported.
 */
public class DisruptionBudgetRule extends AbstractRule {

    public static final String ID = "WK8303";

    public DisruptionBudgetRule() {
        super(ID, "PodDisruptionBudget", "HA deployments should have a PodDisruptionBudget", Severity.INFO);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<CompositeLit> literals = AstWalker.compositeLiterals(file);
        List<Map<String, String>> budgetSelectors = new ArrayList<>();
        for (CompositeLit literal : literals) {
            if (ResourceKinds.is(literal, ResourceKinds.POD_DISRUPTION_BUDGET)) {
                Map<String, String> selector = selectorOf(literal);
                if (!selector.isEmpty()) {
                    budgetSelectors.add(selector);
                }
            }
        }

        List<Issue> issues = new ArrayList<>();
        for (CompositeLit deployment : literals) {
            if (!ResourceKinds.is(deployment, ResourceKinds.DEPLOYMENT) || !Replicas.isHighlyAvailable(deployment)) {
                continue;
            }
            Map<String, String> labels = selectorOf(deployment);
            if (labels.isEmpty()) {
                continue;
            }
            boolean covered = budgetSelectors.stream()
                    .anyMatch(budget -> labels.entrySet().containsAll(budget.entrySet()));
            if (!covered) {
                issues.add(issue(file, deployment, "HA deployment (replicas >= 2) should have a PodDisruptionBudget"));
            }
        }
        return issues;
    }

    private static Map<String, String> selectorOf(CompositeLit resource) {
        return Matchers.pathValue(resource, "Spec", "Selector", "MatchLabels")
                .map(Matchers::mapLiteral)
                .orElse(Map.of());
    }
}
