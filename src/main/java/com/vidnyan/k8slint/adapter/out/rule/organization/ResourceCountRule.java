package com.vidnyan.k8slint.adapter.out.rule.organization;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.List;

/**
 * Counts top-level variables holding a Kubernetes API literal.
 */
public class ResourceCountRule extends AbstractRule {

    public static final String ID = "WK8401";

    static final int MAX_RESOURCES = 20;

    public ResourceCountRule() {
        super(ID, "Resources per file", "Files should not declare more than " + MAX_RESOURCES + " resources",
                Severity.WARNING);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        long count = file.topLevelVars().stream()
                .filter(variable -> ResourceKinds.isApiResource(variable.value()))
                .count();
        if (count <= MAX_RESOURCES) {
            return List.of();
        }
        return List.of(issue(file, 1, 1, String.format(
                "File contains %d resources (max %d), consider splitting into smaller files", count, MAX_RESOURCES)));
    }
}
