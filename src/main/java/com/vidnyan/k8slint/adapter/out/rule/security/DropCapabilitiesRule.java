package com.vidnyan.k8slint.adapter.out.rule.security;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;

import java.util.Optional;

public class DropCapabilitiesRule extends ContainerRule {

    public static final String ID = "WK8205";

    public DropCapabilitiesRule() {
        super(ID, "Drop capabilities", "Containers should drop unnecessary Linux capabilities", Severity.WARNING);
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        int dropped = Matchers.pathValue(container, "SecurityContext", "Capabilities", "Drop")
                .map(Matchers::elementCount)
                .orElse(0);
        if (dropped > 0) {
            return Optional.empty();
        }
        return Optional.of(issue(file, container,
                "Container should drop unnecessary capabilities (e.g., Drop: []string{\"ALL\"})"));
    }
}
