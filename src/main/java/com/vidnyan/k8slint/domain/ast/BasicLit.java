package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * Scalar literal. {@code value} is the literal exactly as written, quotes included.
 */
public record BasicLit(Kind kind, String value, Span span, boolean synthetic) implements Expr {

    public enum Kind { STRING, INT, FLOAT, IMAG, CHAR }

    public static BasicLit of(Kind kind, String value, Span span) {
        return new BasicLit(kind, value, span, false);
    }

    /**
     * Interpreted string literal created by a fix.
     */
    public static BasicLit syntheticString(String text) {
        return new BasicLit(Kind.STRING, GoStrings.quote(text), null, true);
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    /**
     * Unquoted content of a string literal.
     */
    public String stringValue() {
        return GoStrings.unquote(value);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBasicLit(this);
    }

    @Override
    public List<Expr> children() {
        return List.of();
    }
}
