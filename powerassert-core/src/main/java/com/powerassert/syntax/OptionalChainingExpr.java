package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code expression?}: the marker that makes the rest of a postfix chain short-circuit
 * on nil.
 */
public record OptionalChainingExpr(
    Expr expression,
    Token questionMark
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.OPTIONAL_CHAINING;
    }

    @Override
    public List<Syntax> children() {
        return List.of(expression, questionMark);
    }

    @Override
    public OptionalChainingExpr withLeadingTrivia(String trivia) {
        return new OptionalChainingExpr(expression.withLeadingTrivia(trivia), questionMark);
    }

    @Override
    public OptionalChainingExpr withTrailingTrivia(String trivia) {
        return new OptionalChainingExpr(expression, questionMark.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newExpression = transform.apply(expression);
        return newExpression == expression ? this : new OptionalChainingExpr(newExpression, questionMark);
    }
}
