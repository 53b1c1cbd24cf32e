package com.vidnyan.k8slint.domain.match;

import com.vidnyan.k8slint.domain.ast.BasicLit;
import com.vidnyan.k8slint.domain.ast.CallExpr;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.ExprVisitor;
import com.vidnyan.k8slint.domain.ast.Ident;
import com.vidnyan.k8slint.domain.ast.KeyValueExpr;
import com.vidnyan.k8slint.domain.ast.OpaqueExpr;
import com.vidnyan.k8slint.domain.ast.SelectorExpr;
import com.vidnyan.k8slint.domain.ast.TypeExpr;
import com.vidnyan.k8slint.domain.ast.UnaryExpr;

/**
 * Nesting depth of inline composite literals: a literal counts 1 plus the deepest of its
 * element values, {@code &} is transparent and anything that is not a literal counts 0.
 * {@code T{A: U{B: 1}}} has depth 2.
 */
public final class NestingDepth implements ExprVisitor<Integer> {

    /** Deepest nesting a top-level value may have. */
    public static final int MAX_DEPTH = 5;

    private static final NestingDepth INSTANCE = new NestingDepth();

    private NestingDepth() {
    }

    public static int of(Expr expr) {
        return expr == null ? 0 : expr.accept(INSTANCE);
    }

    @Override
    public Integer visitCompositeLit(CompositeLit literal) {
        int deepest = 0;
        for (Expr element : literal.elements()) {
            deepest = Math.max(deepest, element.accept(this));
        }
        return 1 + deepest;
    }

    @Override
    public Integer visitKeyValue(KeyValueExpr keyValue) {
        return keyValue.value().accept(this);
    }

    @Override
    public Integer visitUnary(UnaryExpr unary) {
        return unary.isAddressOf() ? unary.operand().accept(this) : 0;
    }

    @Override
    public Integer visitIdent(Ident ident) {
        return 0;
    }

    @Override
    public Integer visitBasicLit(BasicLit literal) {
        return 0;
    }

    @Override
    public Integer visitCall(CallExpr call) {
        return 0;
    }

    @Override
    public Integer visitSelector(SelectorExpr selector) {
        return 0;
    }

    @Override
    public Integer visitType(TypeExpr type) {
        return 0;
    }

    @Override
    public Integer visitOpaque(OpaqueExpr opaque) {
        return 0;
    }
}
