package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * {@code var} or {@code const} declaration, single or grouped.
 */
public record GenDecl(Keyword keyword, List<ValueSpec> specs, Span span, int leadingStart, boolean synthetic)
        implements Decl {

    public enum Keyword { VAR, CONST }

    public GenDecl {
        specs = List.copyOf(specs);
    }

    /**
     * {@code var name = value}, created by a fix.
     */
    public static GenDecl hoistedVar(String name, Expr value) {
        ValueSpec spec = new ValueSpec(List.of(Ident.synthetic(name, null)), null, List.of(value), null, true);
        return new GenDecl(Keyword.VAR, List.of(spec), null, -1, true);
    }
}
