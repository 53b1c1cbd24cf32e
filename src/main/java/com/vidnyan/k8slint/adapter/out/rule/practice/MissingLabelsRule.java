package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.List;

public class MissingLabelsRule extends AbstractRule {

    public static final String ID = "WK8102";

    public MissingLabelsRule() {
        super(ID, "Resources have labels", "Resources should carry metadata labels", Severity.WARNING);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        return AstWalker.compositeLiterals(file).stream()
                .filter(literal -> ResourceKinds.isAnyOf(literal, ResourceKinds.LABELED_KINDS))
                .filter(resource -> !hasLabels(resource))
                .map(resource -> issue(file, resource, String.format(
                        "%s should have metadata labels for better organization",
                        Matchers.typeNameOf(resource).orElse("Resource"))))
                .toList();
    }

    // A label map held in a variable counts as labeled.
    private static boolean hasLabels(CompositeLit resource) {
        return ResourceKinds.metadata(resource)
                .flatMap(metadata -> Matchers.fieldValue(metadata, "Labels"))
                .map(labels -> Matchers.nestedRecord(labels).map(map -> !map.isEmpty()).orElse(true))
                .orElse(false);
    }
}
