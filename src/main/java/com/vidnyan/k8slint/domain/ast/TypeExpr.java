package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * Composite type such as {@code []T}, {@code [3]T}, {@code map[K]V} or {@code *T}. Plain
 * and package-qualified type names are {@link Ident} and {@link SelectorExpr}.
 *
 * @param element element type of a slice or array, value type of a map, pointee of a pointer
 * @param parts   all sub-expressions in source order
 */
public record TypeExpr(Kind kind, Expr element, List<Expr> parts, Span span) implements Expr {

    public enum Kind { SLICE, ARRAY, MAP, POINTER, OTHER }

    public TypeExpr {
        parts = List.copyOf(parts);
    }

    @Override
    public boolean synthetic() {
        return false;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitType(this);
    }

    @Override
    public List<Expr> children() {
        return parts;
    }
}
