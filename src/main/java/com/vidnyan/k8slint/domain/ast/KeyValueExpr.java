package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * {@code Key: Value} element of a composite literal.
 */
public record KeyValueExpr(Expr key, Expr value, Span span, boolean synthetic) implements Expr {

    public static KeyValueExpr of(Expr key, Expr value, Span span) {
        return new KeyValueExpr(key, value, span, false);
    }

    /**
     * Field assignment created by a fix, {@code Field: value}.
     */
    public static KeyValueExpr syntheticField(String field, Expr value) {
        return new KeyValueExpr(Ident.synthetic(field, null), value, null, true);
    }

    /**
     * Field name when the key is an identifier, else {@code null}.
     */
    public String keyName() {
        return key instanceof Ident ident ? ident.name() : null;
    }

    public KeyValueExpr withValue(Expr newValue) {
        return new KeyValueExpr(key, newValue, span, synthetic);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitKeyValue(this);
    }

    @Override
    public List<Expr> children() {
        return List.of(key, value);
    }
}
