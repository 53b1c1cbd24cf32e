package com.vidnyan.k8slint.adapter.out.rule.security;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;

import java.util.Optional;

/**
 * A hardening flag of the container security context that should be set to {@code true}.
 */
public class SecurityContextFlagRule extends ContainerRule {

    private final String flag;
    private final String purpose;

    public SecurityContextFlagRule(String id, String name, String flag, String purpose) {
        super(id, name, "Containers should set " + flag + ": true", Severity.WARNING);
        this.flag = flag;
        this.purpose = purpose;
    }

    public static SecurityContextFlagRule readOnlyRootFilesystem() {
        return new SecurityContextFlagRule("WK8203", "Read-only root filesystem",
                "ReadOnlyRootFilesystem", "reduce attack surface");
    }

    public static SecurityContextFlagRule runAsNonRoot() {
        return new SecurityContextFlagRule("WK8204", "Run as non-root",
                "RunAsNonRoot", "limit security risks");
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        boolean set = Matchers.pathValue(container, "SecurityContext", flag)
                .filter(Matchers::boolLiteral)
                .isPresent();
        if (set) {
            return Optional.empty();
        }
        return Optional.of(issue(file, container,
                String.format("Container should set %s: true to %s", flag, purpose)));
    }
}
