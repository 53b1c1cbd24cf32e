package com.vidnyan.k8slint.domain.ast;

import java.util.List;

public record UnaryExpr(String operator, Expr operand, Span span, boolean synthetic) implements Expr {

    public static UnaryExpr of(String operator, Expr operand, Span span) {
        return new UnaryExpr(operator, operand, span, false);
    }

    public static UnaryExpr syntheticAddressOf(Expr operand) {
        return new UnaryExpr("&", operand, null, true);
    }

    public boolean isAddressOf() {
        return "&".equals(operator);
    }

    public UnaryExpr withOperand(Expr newOperand) {
        return new UnaryExpr(operator, newOperand, span, synthetic);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public List<Expr> children() {
        return List.of(operand);
    }
}
