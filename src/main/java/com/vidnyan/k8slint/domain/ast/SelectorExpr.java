package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * {@code operand.field}, also used for package-qualified type names such as {@code corev1.Container}.
 */
public record SelectorExpr(Expr operand, String field, Span span) implements Expr {

    /**
     * Leftmost identifier of a selector chain, e.g. {@code PodB} for {@code PodB.Metadata.Name}.
     */
    public Ident root() {
        Expr current = operand;
        while (current instanceof SelectorExpr selector) {
            current = selector.operand();
        }
        return current instanceof Ident ident ? ident : null;
    }

    @Override
    public boolean synthetic() {
        return false;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSelector(this);
    }

    @Override
    public List<Expr> children() {
        return List.of(operand);
    }
}
