package com.vidnyan.k8slint.adapter.out.rule.security;

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

/**
 * A pod spec sharing one of the host's namespaces ({@code HostNetwork}, {@code HostPID},
 * {@code HostIPC}).
 */
public class HostNamespaceRule extends AbstractRule {

    private final String field;
    private final String risk;

    public HostNamespaceRule(String id, String name, String field, String risk) {
        super(id, name, "Pods should not use " + field + ": true", Severity.WARNING);
        this.field = field;
        this.risk = risk;
    }

    public static HostNamespaceRule hostNetwork() {
        return new HostNamespaceRule("WK8207", "No host network", "HostNetwork", "it bypasses network policies");
    }

    public static HostNamespaceRule hostPid() {
        return new HostNamespaceRule("WK8208", "No host PID", "HostPID", "it allows viewing host processes");
    }

    public static HostNamespaceRule hostIpc() {
        return new HostNamespaceRule("WK8209", "No host IPC", "HostIPC", "it enables IPC with host processes");
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (CompositeLit literal : AstWalker.compositeLiterals(file)) {
            if (!ResourceKinds.isPodSpec(literal)) {
                continue;
            }
            Matchers.field(literal, field)
                    .filter(keyValue -> Matchers.boolLiteral(keyValue.value()))
                    .ifPresent(keyValue -> issues.add(issue(file, keyValue,
                            String.format("Pod should not use %s: true, %s", field, risk))));
        }
        return issues;
    }
}
