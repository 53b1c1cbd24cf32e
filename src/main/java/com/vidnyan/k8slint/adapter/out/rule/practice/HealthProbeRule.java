package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class HealthProbeRule extends ContainerRule {

    public static final String ID = "WK8301";

    public HealthProbeRule() {
        super(ID, "Health probes", "Containers should define liveness and readiness probes", Severity.WARNING);
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        List<String> missing = new ArrayList<>();
        if (!Matchers.hasField(container, "LivenessProbe")) {
            missing.add("liveness");
        }
        if (!Matchers.hasField(container, "ReadinessProbe")) {
            missing.add("readiness");
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(issue(file, container, String.format(
                "Container should have %s probe(s) for automatic failure detection", String.join(" and ", missing))));
    }
}
