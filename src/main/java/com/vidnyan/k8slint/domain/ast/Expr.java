package com.vidnyan.k8slint.domain.ast;

import java.util.List;

/**
 * Closed set of expression shapes the linter distinguishes. Everything else the
 * grammar knows about is carried as an {@link OpaqueExpr}.
 */
public sealed interface Expr extends Node
        permits Ident, BasicLit, CompositeLit, KeyValueExpr, UnaryExpr, CallExpr,
                SelectorExpr, TypeExpr, OpaqueExpr {

    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Direct sub-expressions in source order.
     */
    List<Expr> children();
}
