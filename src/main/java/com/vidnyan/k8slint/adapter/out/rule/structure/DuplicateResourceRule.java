package com.vidnyan.k8slint.adapter.out.rule.structure;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.TopLevelVar;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two top-level resources in one file must not share a metadata name within a namespace.
 */
public class DuplicateResourceRule extends AbstractRule {

    public static final String ID = "WK8003";

    static final String DEFAULT_NAMESPACE = "default";

    public DuplicateResourceRule() {
        super(ID, "Duplicate resource names",
                "Resource names must be unique within a namespace", Severity.ERROR);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        Map<Identity, TopLevelVar> firstDeclared = new HashMap<>();
        for (TopLevelVar variable : file.topLevelVars()) {
            Optional<Identity> identity = identityOf(variable);
            if (identity.isEmpty()) {
                continue;
            }
            TopLevelVar first = firstDeclared.putIfAbsent(identity.get(), variable);
            if (first != null) {
                issues.add(issue(file, variable.name(), String.format(
                        "Duplicate resource name \"%s\" in namespace \"%s\", already declared by %s at line %d",
                        identity.get().name(), identity.get().namespace(), first.nameText(), first.line())));
            }
        }
        return issues;
    }

    private static Optional<Identity> identityOf(TopLevelVar variable) {
        Optional<CompositeLit> metadata = Matchers.nestedRecord(variable.value()).flatMap(ResourceKinds::metadata);
        Optional<String> name = metadata.flatMap(meta -> Matchers.fieldValue(meta, "Name"))
                .flatMap(Matchers::stringLiteral)
                .filter(value -> !value.isEmpty());
        if (name.isEmpty()) {
            return Optional.empty();
        }
        String namespace = metadata.flatMap(meta -> Matchers.fieldValue(meta, "Namespace"))
                .flatMap(Matchers::stringLiteral)
                .filter(value -> !value.isEmpty())
                .orElse(DEFAULT_NAMESPACE);
        return Optional.of(new Identity(namespace, name.get()));
    }

    private record Identity(String namespace, String name) {
    }
}
