package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;

import java.util.Optional;

public class ContainerNameRule extends ContainerRule {

    public static final String ID = "WK8103";

    public ContainerNameRule() {
        super(ID, "Container names", "Containers must have a name", Severity.WARNING);
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        if (Names.isNamed(container)) {
            return Optional.empty();
        }
        return Optional.of(issue(file, container, "Container must have a Name field"));
    }
}
