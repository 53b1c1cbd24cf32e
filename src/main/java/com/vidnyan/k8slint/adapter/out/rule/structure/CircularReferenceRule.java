package com.vidnyan.k8slint.adapter.out.rule.structure;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.TopLevelVar;
import com.vidnyan.k8slint.domain.graph.ReferenceGraph;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public class CircularReferenceRule extends AbstractRule {

    public static final String ID = "WK8004";

    public CircularReferenceRule() {
        super(ID, "Circular dependencies",
                "Resources must not reference each other in a cycle", Severity.ERROR);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        ReferenceGraph graph = ReferenceGraph.build(file);
        if (!graph.hasCycles()) {
            return List.of();
        }
        Map<String, TopLevelVar> variables = file.topLevelVars().stream()
                .collect(Collectors.toMap(TopLevelVar::nameText, Function.identity(), (first, second) -> first));
        List<Issue> issues = new ArrayList<>();
        for (List<String> cycle : graph.getCycles()) {
            TopLevelVar start = variables.get(cycle.get(0));
            issues.add(issue(file, start.name(),
                    "Circular dependency detected: " + String.join(" -> ", cycle)));
        }
        return issues;
    }
}
