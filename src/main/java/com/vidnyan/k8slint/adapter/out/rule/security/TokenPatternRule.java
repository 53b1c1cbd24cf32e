package com.vidnyan.k8slint.adapter.out.rule.security;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.BasicLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Any string literal that carries a well-known credential prefix, wherever it appears.
 * <p>
 * Free-text markers ({@code Bearer }, {@code api_key=}, {@code apikey=}, {@code token:})
 * match in any case. Provider key prefixes ({@code AKIA}, {@code ghp_}, {@code sk_live_}
 * and the rest) match case-sensitively, so {@code akia...} or {@code GHP_...} is not
 * reported.
 */
public class TokenPatternRule extends AbstractRule {

    public static final String ID = "WK8041";

    private static final List<Signature> SIGNATURES = List.of(
            new Signature("Bearer ", true),
            new Signature("api_key=", true),
            new Signature("apikey=", true),
            new Signature("token:", true),
            new Signature("ghp_", false),
            new Signature("gho_", false),
            new Signature("ghs_", false),
            new Signature("AKIA", false),
            new Signature("sk_live_", false),
            new Signature("sk_test_", false),
            new Signature("rk_live_", false),
            new Signature("pk_live_", false));

    public TokenPatternRule() {
        super(ID, "Hardcoded API keys/tokens", "Hardcoded API keys/tokens detected", Severity.ERROR);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (BasicLit literal : AstWalker.stringLiterals(file)) {
            String value = literal.stringValue();
            firstMatch(value).ifPresent(signature -> issues.add(issue(file, literal, String.format(
                    "Hardcoded API key/token pattern detected: \"%s\", use SecretKeyRef instead",
                    signature.marker()))));
        }
        return issues;
    }

    static Optional<Signature> firstMatch(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return SIGNATURES.stream().filter(signature -> signature.foundIn(value, lower)).findFirst();
    }

    record Signature(String marker, boolean ignoreCase) {

        boolean foundIn(String value, String lowerValue) {
            return ignoreCase ? lowerValue.contains(marker.toLowerCase(Locale.ROOT)) : value.contains(marker);
        }
    }
}
