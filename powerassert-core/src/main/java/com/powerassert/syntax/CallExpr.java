package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code callee(arguments)} with an optional trailing closure.
 */
public record CallExpr(
    Expr callee,
    Token leftParen,
    List<ListElement> arguments,
    Token rightParen,
    ClosureExpr trailingClosure
) implements Expr {
    public CallExpr {
        arguments = List.copyOf(arguments);
    }

    public CallExpr(Expr callee, Token leftParen, List<ListElement> arguments, Token rightParen) {
        this(callee, leftParen, arguments, rightParen, null);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.CALL;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(callee, leftParen, arguments, rightParen, trailingClosure);
    }

    @Override
    public CallExpr withLeadingTrivia(String trivia) {
        return new CallExpr(callee.withLeadingTrivia(trivia), leftParen, arguments, rightParen, trailingClosure);
    }

    @Override
    public CallExpr withTrailingTrivia(String trivia) {
        if (trailingClosure != null) {
            return new CallExpr(callee, leftParen, arguments, rightParen, trailingClosure.withTrailingTrivia(trivia));
        }
        return new CallExpr(callee, leftParen, arguments, rightParen.withTrailingTrivia(trivia), null);
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newCallee = transform.apply(callee);
        List<ListElement> newArguments = ListElement.mapExpressions(arguments, transform);
        if (newCallee == callee && newArguments == arguments) {
            return this;
        }
        return new CallExpr(newCallee, leftParen, newArguments, rightParen, trailingClosure);
    }
}
