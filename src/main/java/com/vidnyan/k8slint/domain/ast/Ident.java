package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * Identifier. The predeclared {@code true}, {@code false} and {@code nil} are identifiers too.
 */
public record Ident(String name, Span span, boolean synthetic) implements Expr {

    public static Ident of(String name, Span span) {
        return new Ident(name, span, false);
    }

    /**
     * Identifier created by a fix, occupying {@code slot} (may be null).
     */
    public static Ident synthetic(String name, Span slot) {
        return new Ident(name, slot, true);
    }

    public boolean isBlank() {
        return "_".equals(name);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIdent(this);
    }

    @Override
    public List<Expr> children() {
        return List.of();
    }
}
