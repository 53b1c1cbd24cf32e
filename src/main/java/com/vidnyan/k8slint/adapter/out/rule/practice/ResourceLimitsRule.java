package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;

import java.util.Optional;

/**
 * Requests alone do not bound a container; {@code Resources.Limits} must be non-empty.
 */
public class ResourceLimitsRule extends ContainerRule {

    public static final String ID = "WK8201";

    public ResourceLimitsRule() {
        super(ID, "Resource limits", "Containers should define resource limits", Severity.WARNING);
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        boolean limited = Matchers.pathValue(container, "Resources", "Limits")
                .map(limits -> Matchers.nestedRecord(limits).map(map -> !map.isEmpty()).orElse(true))
                .orElse(false);
        if (limited) {
            return Optional.empty();
        }
        return Optional.of(issue(file, container,
                "Container should have resource limits (cpu, memory) to prevent resource exhaustion"));
    }
}
