package com.vidnyan.k8slint.domain.ast;

/**
 * Function or method declaration; {@code body} is {@code null} for external functions.
 */
public record FuncDecl(String name, Expr body, Span span, int leadingStart) implements Decl {

    @Override
    public boolean synthetic() {
        return false;
    }
}
