package com.vidnyan.k8slint.adapter.out.rule.structure;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.CallExpr;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.Ident;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.TopLevelVar;
import com.vidnyan.k8slint.domain.ast.UnaryExpr;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Resources must be declared as composite literals so they can be read without running
 * code. Conversions and builtins ({@code int32(3)}, {@code make(...)}) are not flagged.
 */
public class DirectDeclarationRule extends AbstractRule {

    public static final String ID = "WK8001";

    private static final Set<String> BUILTINS = Set.of(
            "bool", "byte", "rune", "string", "error", "any",
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64", "uintptr",
            "float32", "float64", "complex64", "complex128",
            "new", "make", "len", "cap", "append", "min", "max");

    public DirectDeclarationRule() {
        super(ID, "Top-level resource declarations",
                "Resources should be top-level composite literals, not function call results", Severity.ERROR);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (TopLevelVar variable : file.topLevelVars()) {
            Expr value = variable.value();
            Expr inner = value instanceof UnaryExpr unary && unary.isAddressOf() ? unary.operand() : value;
            if (inner instanceof CallExpr call && !isBuiltin(call)) {
                issues.add(issue(file, value, String.format(
                        "%s is initialized by a function call, declare it as a composite literal instead",
                        variable.nameText())));
            }
        }
        return issues;
    }

    private static boolean isBuiltin(CallExpr call) {
        return call.function() instanceof Ident ident && BUILTINS.contains(ident.name());
    }
}
