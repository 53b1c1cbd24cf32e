package com.vidnyan.k8slint.domain.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Function call. Go conversions such as {@code int32(3)} parse as calls too.
 */
public record CallExpr(Expr function, List<Expr> arguments, Span span) implements Expr {

    public CallExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public boolean synthetic() {
        return false;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public List<Expr> children() {
        List<Expr> children = new ArrayList<>(arguments.size() + 1);
        children.add(function);
        children.addAll(arguments);
        return children;
    }
}
