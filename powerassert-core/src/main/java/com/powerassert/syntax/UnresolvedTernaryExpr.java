package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The {@code ? firstChoice :} element of a {@link SequenceExpr}. Folding turns it and its
 * neighbours into a {@link TernaryExpr}.
 */
public record UnresolvedTernaryExpr(
    Token questionMark,
    Expr firstChoice,
    Token colon
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_TERNARY;
    }

    @Override
    public List<Syntax> children() {
        return List.of(questionMark, firstChoice, colon);
    }

    @Override
    public UnresolvedTernaryExpr withLeadingTrivia(String trivia) {
        return new UnresolvedTernaryExpr(questionMark.withLeadingTrivia(trivia), firstChoice, colon);
    }

    @Override
    public UnresolvedTernaryExpr withTrailingTrivia(String trivia) {
        return new UnresolvedTernaryExpr(questionMark, firstChoice, colon.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newFirst = transform.apply(firstChoice);
        return newFirst == firstChoice ? this : new UnresolvedTernaryExpr(questionMark, newFirst, colon);
    }
}
