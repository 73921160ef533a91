package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

public record SubscriptExpr(
    Expr callee,
    Token leftBracket,
    List<ListElement> arguments,
    Token rightBracket
) implements Expr {
    public SubscriptExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SUBSCRIPT;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(callee, leftBracket, arguments, rightBracket);
    }

    @Override
    public SubscriptExpr withLeadingTrivia(String trivia) {
        return new SubscriptExpr(callee.withLeadingTrivia(trivia), leftBracket, arguments, rightBracket);
    }

    @Override
    public SubscriptExpr withTrailingTrivia(String trivia) {
        return new SubscriptExpr(callee, leftBracket, arguments, rightBracket.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newCallee = transform.apply(callee);
        List<ListElement> newArguments = ListElement.mapExpressions(arguments, transform);
        if (newCallee == callee && newArguments == arguments) {
            return this;
        }
        return new SubscriptExpr(newCallee, leftBracket, newArguments, rightBracket);
    }
}
