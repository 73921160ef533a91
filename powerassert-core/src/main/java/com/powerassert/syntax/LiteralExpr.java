package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Integer, float, boolean, string or nil literal. The token kind tells which.
 */
public record LiteralExpr(
    Token token
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.LITERAL;
    }

    @Override
    public List<Syntax> children() {
        return List.of(token);
    }

    @Override
    public LiteralExpr withLeadingTrivia(String trivia) {
        return new LiteralExpr(token.withLeadingTrivia(trivia));
    }

    @Override
    public LiteralExpr withTrailingTrivia(String trivia) {
        return new LiteralExpr(token.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        return this;
    }
}
