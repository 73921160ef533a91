package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

public record ForceUnwrapExpr(
    Expr expression,
    Token exclamationMark
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.FORCE_UNWRAP;
    }

    @Override
    public List<Syntax> children() {
        return List.of(expression, exclamationMark);
    }

    @Override
    public ForceUnwrapExpr withLeadingTrivia(String trivia) {
        return new ForceUnwrapExpr(expression.withLeadingTrivia(trivia), exclamationMark);
    }

    @Override
    public ForceUnwrapExpr withTrailingTrivia(String trivia) {
        return new ForceUnwrapExpr(expression, exclamationMark.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newExpression = transform.apply(expression);
        return newExpression == expression ? this : new ForceUnwrapExpr(newExpression, exclamationMark);
    }
}
