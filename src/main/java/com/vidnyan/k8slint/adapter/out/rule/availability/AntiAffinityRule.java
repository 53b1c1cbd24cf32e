package com.vidnyan.k8slint.adapter.out.rule.availability;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.List;

public class AntiAffinityRule extends AbstractRule {

    public static final String ID = "WK8304";

    public AntiAffinityRule() {
        super(ID, "Pod anti-affinity", "HA deployments should spread pods with anti-affinity", Severity.INFO);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        return AstWalker.compositeLiterals(file).stream()
                .filter(literal -> ResourceKinds.is(literal, ResourceKinds.DEPLOYMENT))
                .filter(Replicas::isHighlyAvailable)
                .filter(deployment -> Matchers.pathValue(deployment,
                        "Spec", "Template", "Spec", "Affinity", "PodAntiAffinity").isEmpty())
                .map(deployment -> issue(file, deployment,
                        "HA deployment (replicas >= 2) should use pod anti-affinity to spread across nodes"))
                .toList();
    }
}
