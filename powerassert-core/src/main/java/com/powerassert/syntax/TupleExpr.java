package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code (a, b)}, or a parenthesized expression when it holds a single unlabelled element.
 */
public record TupleExpr(
    Token leftParen,
    List<ListElement> elements,
    Token rightParen
) implements Expr {
    public TupleExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.TUPLE;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(leftParen, elements, rightParen);
    }

    @Override
    public TupleExpr withLeadingTrivia(String trivia) {
        return new TupleExpr(leftParen.withLeadingTrivia(trivia), elements, rightParen);
    }

    @Override
    public TupleExpr withTrailingTrivia(String trivia) {
        return new TupleExpr(leftParen, elements, rightParen.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        List<ListElement> newElements = ListElement.mapExpressions(elements, transform);
        return newElements == elements ? this : new TupleExpr(leftParen, newElements, rightParen);
    }
}
