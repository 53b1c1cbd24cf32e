package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Every selector label of a workload must appear, with the same value, among the labels
 * of its pod template; otherwise the workload never matches its own pods.
 * <p>
 * Label maps held in variables are not resolved, so such workloads are skipped.
 */
public class SelectorLabelRule extends AbstractRule {

    public static final String ID = "WK8101";

    public SelectorLabelRule() {
        super(ID, "Selector matches template labels",
                "Workload selector labels must be a subset of the pod template labels", Severity.ERROR);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (CompositeLit workload : AstWalker.compositeLiterals(file)) {
            if (!ResourceKinds.isAnyOf(workload, ResourceKinds.SELECTOR_WORKLOADS)) {
                continue;
            }
            Optional<Expr> selectorExpr = Matchers.pathValue(workload, "Spec", "Selector", "MatchLabels");
            if (selectorExpr.isEmpty()) {
                continue;
            }
            Optional<Expr> templateExpr = Matchers.pathValue(workload, "Spec", "Template", ResourceKinds.METADATA, "Labels");
            if (templateExpr.isPresent() && Matchers.nestedRecord(templateExpr.get()).isEmpty()) {
                continue;
            }
            Map<String, String> selector = new TreeMap<>(Matchers.mapLiteral(selectorExpr.get()));
            Map<String, String> template = templateExpr.map(Matchers::mapLiteral).orElse(Map.of());
            for (Map.Entry<String, String> label : selector.entrySet()) {
                String actual = template.get(label.getKey());
                if (actual == null) {
                    issues.add(issue(file, selectorExpr.get(), String.format(
                            "Selector label \"%s\" not found in template labels", label.getKey())));
                } else if (!actual.equals(label.getValue())) {
                    issues.add(issue(file, selectorExpr.get(), String.format(
                            "Selector label \"%s\" has value \"%s\" but template has \"%s\"",
                            label.getKey(), label.getValue(), actual)));
                }
            }
        }
        return issues;
    }
}
