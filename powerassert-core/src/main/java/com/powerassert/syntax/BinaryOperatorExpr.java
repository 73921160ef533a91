package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An operator token standing as an element of a {@link SequenceExpr}, or as the operator
 * of a folded {@link InfixOperatorExpr}.
 */
public record BinaryOperatorExpr(
    Token operator
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.BINARY_OPERATOR;
    }

    @Override
    public List<Syntax> children() {
        return List.of(operator);
    }

    @Override
    public BinaryOperatorExpr withLeadingTrivia(String trivia) {
        return new BinaryOperatorExpr(operator.withLeadingTrivia(trivia));
    }

    @Override
    public BinaryOperatorExpr withTrailingTrivia(String trivia) {
        return new BinaryOperatorExpr(operator.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        return this;
    }
}
