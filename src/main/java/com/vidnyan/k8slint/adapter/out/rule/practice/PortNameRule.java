package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.List;

/**
 * Container and service ports should be named.
 */
public class PortNameRule extends AbstractRule {

    public static final String ID = "WK8104";

    public PortNameRule() {
        super(ID, "Port names", "Container and service ports should have a name", Severity.WARNING);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        return AstWalker.compositeLiterals(file).stream()
                .filter(ResourceKinds::isPort)
                .filter(port -> !Names.isNamed(port))
                .map(port -> issue(file, port, String.format(
                        "%s should have a Name for better documentation and service mesh support",
                        Matchers.typeNameOf(port).orElse("Port"))))
                .toList();
    }
}
