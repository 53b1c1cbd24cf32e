package com.vidnyan.k8slint.domain.ast;

/**
 * A package-level {@code var} binding with an initializer.
 *
 * @param valueIndex index of {@code value} in {@code spec.values()}
 */
public record TopLevelVar(Ident name, Expr value, ValueSpec spec, int valueIndex) {

    public String nameText() {
        return name.name();
    }

    public int line() {
        return name.span() == null ? 0 : name.span().line();
    }
}
