package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * Any syntax the linter does not model, kept with its sub-expressions so that walks
 * still reach literals nested inside it (function bodies, binary expressions, ...).
 *
 * @param kind tree-sitter node type
 */
public record OpaqueExpr(String kind, List<Expr> parts, Span span) implements Expr {

    public OpaqueExpr {
        parts = List.copyOf(parts);
    }

    @Override
    public boolean synthetic() {
        return false;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOpaque(this);
    }

    @Override
    public List<Expr> children() {
        return parts;
    }
}
