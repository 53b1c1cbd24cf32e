package com.vidnyan.k8slint.domain.ast;

/**
 * Top-level declaration.
 */
public sealed interface Decl extends Node permits GenDecl, FuncDecl, OpaqueDecl {

    /**
     * Offset where the declaration's doc comment starts, or its own start when it has none.
     * Declarations inserted by a fix go in front of this offset.
     */
    int leadingStart();
}
