package com.vidnyan.k8slint.domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@code name1, name2 T = value1, value2} line of a var or const declaration.
 */
public final class ValueSpec implements Node {

    private final List<Ident> names;
    private final Expr type;
    private final List<Expr> values;
    private final Span span;
    private final boolean synthetic;

    public ValueSpec(List<Ident> names, Expr type, List<Expr> values, Span span, boolean synthetic) {
        this.names = List.copyOf(names);
        this.type = type;
        this.values = new ArrayList<>(values);
        this.span = span;
        this.synthetic = synthetic;
    }

    public List<Ident> names() {
        return names;
    }

    public Expr type() {
        return type;
    }

    public List<Expr> values() {
        return Collections.unmodifiableList(values);
    }

    public void replaceValue(int index, Expr value) {
        values.set(index, value);
    }

    @Override
    public Span span() {
        return span;
    }

    @Override
    public boolean synthetic() {
        return synthetic;
    }
}
