package com.vidnyan.k8slint.domain.ast;

/**
 * Any node of a parsed Go file.
 */
public sealed interface Node permits Expr, Decl, ValueSpec {

    /**
     * Source extent. For a node created by a fix this is either the slot it replaces
     * or {@code null} when it was inserted without replacing anything.
     */
    Span span();

    /**
     * True when the node was created by a fix rather than read from source.
     */
    boolean synthetic();
}
