package com.vidnyan.k8slint.adapter.out.rule.security;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Environment variables whose name looks sensitive must take their value from a Secret,
 * not from a literal.
 */
public class HardcodedSecretRule extends AbstractRule {

    public static final String ID = "WK8005";

    private static final List<String> SENSITIVE_NAMES = List.of(
            "password", "passwd", "pwd", "secret", "token", "key",
            "api_key", "apikey", "auth", "credential", "private");

    public HardcodedSecretRule() {
        super(ID, "Flag hardcoded secrets", "Flag hardcoded secrets in env vars", Severity.ERROR);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (CompositeLit literal : AstWalker.compositeLiterals(file)) {
            if (!ResourceKinds.isEnvVar(literal)) {
                continue;
            }
            Optional<String> name = Matchers.fieldValue(literal, "Name").flatMap(Matchers::stringLiteral);
            if (name.isEmpty() || !isSensitive(name.get())) {
                continue;
            }
            Optional<Expr> value = Matchers.fieldValue(literal, "Value");
            boolean literalValue = value.flatMap(Matchers::stringLiteral).filter(v -> !v.isEmpty()).isPresent();
            if (literalValue) {
                issues.add(issue(file, value.get(), String.format(
                        "Hardcoded secret detected in environment variable \"%s\", use SecretKeyRef instead",
                        name.get())));
            }
        }
        return issues;
    }

    static boolean isSensitive(String envName) {
        String lower = envName.toLowerCase(Locale.ROOT);
        return SENSITIVE_NAMES.stream().anyMatch(lower::contains);
    }
}
