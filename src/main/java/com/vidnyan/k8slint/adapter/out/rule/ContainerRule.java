package com.vidnyan.k8slint.adapter.out.rule;

import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A rule that inspects every container literal of a file on its own.
 */
public abstract class ContainerRule extends AbstractRule {

    protected ContainerRule(String id, String name, String description, Severity severity) {
        super(id, name, description, severity);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (CompositeLit literal : AstWalker.compositeLiterals(file)) {
            if (ResourceKinds.isContainer(literal)) {
                checkContainer(file, literal).ifPresent(issues::add);
            }
        }
        return issues;
    }

    protected abstract Optional<Issue> checkContainer(SourceFile file, CompositeLit container);
}
