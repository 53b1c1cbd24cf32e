package com.vidnyan.k8slint.adapter.out.rule.security;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;

import java.util.Optional;

public class PrivilegedContainerRule extends ContainerRule {

    public static final String ID = "WK8202";

    public PrivilegedContainerRule() {
        super(ID, "Privileged containers", "Containers should not run in privileged mode", Severity.ERROR);
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        return Matchers.path(container, "SecurityContext")
                .flatMap(context -> Matchers.field(context, "Privileged"))
                .filter(privileged -> Matchers.boolLiteral(privileged.value()))
                .map(privileged -> issue(file, privileged,
                        "Container should not run in privileged mode, it has full access to the host"));
    }
}
