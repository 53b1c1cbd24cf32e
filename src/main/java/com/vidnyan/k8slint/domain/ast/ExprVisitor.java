package com.vidnyan.k8slint.domain.ast;

public interface ExprVisitor<R> {

    R visitIdent(Ident ident);

    R visitBasicLit(BasicLit literal);

    R visitCompositeLit(CompositeLit literal);

    R visitKeyValue(KeyValueExpr keyValue);

    R visitUnary(UnaryExpr unary);

    R visitCall(CallExpr call);

    R visitSelector(SelectorExpr selector);

    R visitType(TypeExpr type);

    R visitOpaque(OpaqueExpr opaque);
}
