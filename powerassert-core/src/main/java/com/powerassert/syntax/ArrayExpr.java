package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

public record ArrayExpr(
    Token leftSquare,
    List<ListElement> elements,
    Token rightSquare
) implements Expr {
    public ArrayExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARRAY;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(leftSquare, elements, rightSquare);
    }

    @Override
    public ArrayExpr withLeadingTrivia(String trivia) {
        return new ArrayExpr(leftSquare.withLeadingTrivia(trivia), elements, rightSquare);
    }

    @Override
    public ArrayExpr withTrailingTrivia(String trivia) {
        return new ArrayExpr(leftSquare, elements, rightSquare.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        List<ListElement> newElements = ListElement.mapExpressions(elements, transform);
        return newElements == elements ? this : new ArrayExpr(leftSquare, newElements, rightSquare);
    }
}
