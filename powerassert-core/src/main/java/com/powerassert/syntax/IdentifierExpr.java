package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A bare name. The token is usually an identifier or keyword ({@code self}) but may be
 * a binary operator used as a function value, as in {@code reduce(0, +)}.
 */
public record IdentifierExpr(
    Token identifier
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.IDENTIFIER;
    }

    @Override
    public List<Syntax> children() {
        return List.of(identifier);
    }

    @Override
    public IdentifierExpr withLeadingTrivia(String trivia) {
        return new IdentifierExpr(identifier.withLeadingTrivia(trivia));
    }

    @Override
    public IdentifierExpr withTrailingTrivia(String trivia) {
        return new IdentifierExpr(identifier.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        return this;
    }
}
