package com.vidnyan.k8slint.domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Composite literal {@code T{...}}. When the type is elided inside a typed slice, array
 * or map literal, {@link #impliedType()} holds the element type of the enclosing literal.
 * <p>
 * The element list is the only part of the tree a fix mutates in place; every other
 * rewrite replaces a whole node in its parent.
 */
public final class CompositeLit implements Expr {

    private final Expr type;
    private final Expr impliedType;
    private final boolean impliedPointer;
    private final List<Expr> elements;
    private final Span span;

    public CompositeLit(Expr type, Expr impliedType, boolean impliedPointer, List<Expr> elements, Span span) {
        this.type = type;
        this.impliedType = type == null ? impliedType : null;
        this.impliedPointer = type == null && impliedPointer;
        this.elements = new ArrayList<>(elements);
        this.span = span;
    }

    /**
     * Declared type, or {@code null} when elided.
     */
    public Expr type() {
        return type;
    }

    public Expr impliedType() {
        return impliedType;
    }

    /**
     * True when the enclosing literal's element type is a pointer, so that the elided
     * literal stands for {@code &T{...}}.
     */
    public boolean impliedPointer() {
        return impliedPointer;
    }

    /**
     * Declared type if present, else the implied one.
     */
    public Expr effectiveType() {
        return type != null ? type : impliedType;
    }

    public List<Expr> elements() {
        return Collections.unmodifiableList(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public void replaceElement(int index, Expr element) {
        elements.set(index, element);
    }

    public void insertElement(int index, Expr element) {
        elements.add(index, element);
    }

    /**
     * Same literal with {@code type} spelled out; used when the literal leaves its
     * enclosing context and the elided type would no longer be inferable.
     */
    public CompositeLit withType(Expr type) {
        return new CompositeLit(type, null, false, elements, span);
    }

    @Override
    public Span span() {
        return span;
    }

    @Override
    public boolean synthetic() {
        return false;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCompositeLit(this);
    }

    @Override
    public List<Expr> children() {
        List<Expr> children = new ArrayList<>(elements.size() + 1);
        if (type != null && span != null && span.encloses(type.span())) {
            children.add(type);
        }
        children.addAll(elements);
        return children;
    }

    @Override
    public String toString() {
        return "CompositeLit[" + (span == null ? "synthetic" : span.format()) + ", " + elements.size() + " elements]";
    }
}
