package com.vidnyan.k8slint.domain.ast;

/**
 * Import or type declaration; printed back verbatim.
 */
public record OpaqueDecl(String kind, Span span, int leadingStart) implements Decl {

    @Override
    public boolean synthetic() {
        return false;
    }
}
