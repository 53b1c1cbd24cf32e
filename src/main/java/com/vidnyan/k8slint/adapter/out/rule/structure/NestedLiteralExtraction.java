package com.vidnyan.k8slint.adapter.out.rule.structure;

import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.GenDecl;
import com.vidnyan.k8slint.domain.ast.Ident;
import com.vidnyan.k8slint.domain.ast.KeyValueExpr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.TopLevelVar;
import com.vidnyan.k8slint.domain.ast.UnaryExpr;
import com.vidnyan.k8slint.domain.lint.FixResult;
import com.vidnyan.k8slint.domain.lint.RuleFix;
import com.vidnyan.k8slint.domain.match.NestingDepth;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Hoists literals nested four or more levels below a too-deep top-level value into their
 * own variables, innermost first, and puts those variables in front of the first var
 * declaration of the file. A hoisted literal is named after the variable, the field that
 * held it ({@code Nested} for list elements) and a counter, e.g. {@code WebEnv2}.
 */
class NestedLiteralExtraction implements RuleFix {

    static final int HOIST_DEPTH = 4;

    private final String ruleId;

    NestedLiteralExtraction(String ruleId) {
        this.ruleId = ruleId;
    }

    @Override
    public List<FixResult> apply(SourceFile file) {
        List<FixResult> results = new ArrayList<>();
        List<GenDecl> hoisted = new ArrayList<>();
        Set<String> taken = file.topLevelNames();
        for (TopLevelVar variable : file.topLevelVars()) {
            if (NestingDepth.of(variable.value()) <= NestingDepth.MAX_DEPTH) {
                continue;
            }
            Extraction extraction = new Extraction(variable.nameText(), taken);
            Expr rewritten = extraction.rewrite(variable.value(), 0, "");
            if (extraction.declarations.isEmpty()) {
                continue;
            }
            variable.spec().replaceValue(variable.valueIndex(), rewritten);
            hoisted.addAll(extraction.declarations);
            results.add(FixResult.applied(file.path(), ruleId, String.format(
                    "Extracted %d nested structure(s) from %s at line %d",
                    extraction.declarations.size(), variable.nameText(), variable.line())));
        }
        if (!hoisted.isEmpty()) {
            file.insertBeforeFirstVar(hoisted);
        }
        return results;
    }

    private static final class Extraction {

        private final String parent;
        private final Set<String> taken;
        private final List<GenDecl> declarations = new ArrayList<>();
        private int counter;

        Extraction(String parent, Set<String> taken) {
            this.parent = parent;
            this.taken = taken;
        }

        Expr rewrite(Expr expr, int depth, String fieldName) {
            if (expr instanceof UnaryExpr unary) {
                Expr operand = rewrite(unary.operand(), depth, fieldName);
                return operand == unary.operand() ? unary : unary.withOperand(operand);
            }
            if (!(expr instanceof CompositeLit literal)) {
                return expr;
            }
            List<Expr> elements = literal.elements();
            for (int i = 0; i < elements.size(); i++) {
                Expr element = elements.get(i);
                if (element instanceof KeyValueExpr keyValue) {
                    String key = keyValue.keyName() == null ? "" : keyValue.keyName();
                    Expr value = rewrite(keyValue.value(), depth + 1, key);
                    if (value != keyValue.value()) {
                        literal.replaceElement(i, keyValue.withValue(value));
                    }
                } else {
                    Expr value = rewrite(element, depth + 1, "");
                    if (value != element) {
                        literal.replaceElement(i, value);
                    }
                }
            }
            if (depth < HOIST_DEPTH || literal.isEmpty()) {
                return literal;
            }
            String name = nextName(fieldName);
            declarations.add(GenDecl.hoistedVar(name, standalone(literal)));
            return Ident.synthetic(name, literal.span());
        }

        private String nextName(String fieldName) {
            String label = fieldName.isEmpty() ? "Nested" : fieldName;
            String name;
            do {
                counter++;
                name = parent + label + counter;
            } while (taken.contains(name));
            taken.add(name);
            return name;
        }

        // An elided {...} needs its type spelled out once it stands on its own.
        private static Expr standalone(CompositeLit literal) {
            if (literal.type() != null || literal.impliedType() == null) {
                return literal;
            }
            CompositeLit typed = literal.withType(literal.impliedType());
            return literal.impliedPointer() ? UnaryExpr.syntheticAddressOf(typed) : typed;
        }
    }
}
