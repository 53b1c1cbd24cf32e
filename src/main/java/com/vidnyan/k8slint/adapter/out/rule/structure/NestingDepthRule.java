package com.vidnyan.k8slint.adapter.out.rule.structure;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.TopLevelVar;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.RuleFix;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.NestingDepth;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class NestingDepthRule extends AbstractRule {

    public static final String ID = "WK8002";

    private final RuleFix fix = new NestedLiteralExtraction(ID);

    public NestingDepthRule() {
        super(ID, "Nesting depth limit",
                "Avoid deeply nested inline structures (max depth " + NestingDepth.MAX_DEPTH + ")",
                Severity.WARNING);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (TopLevelVar variable : file.topLevelVars()) {
            int depth = NestingDepth.of(variable.value());
            if (depth > NestingDepth.MAX_DEPTH) {
                issues.add(issue(file, variable.name(), String.format(
                        "%s has nesting depth %d (max %d), extract nested structures into separate variables",
                        variable.nameText(), depth, NestingDepth.MAX_DEPTH)));
            }
        }
        return issues;
    }

    @Override
    public Optional<RuleFix> fix() {
        return Optional.of(fix);
    }
}
