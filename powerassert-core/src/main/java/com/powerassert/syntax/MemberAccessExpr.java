package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code base.name}. The base is null for an implicit member such as {@code .none}.
 */
public record MemberAccessExpr(
    Expr base,
    Token period,
    Token name
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.MEMBER_ACCESS;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(base, period, name);
    }

    @Override
    public MemberAccessExpr withLeadingTrivia(String trivia) {
        if (base != null) {
            return new MemberAccessExpr(base.withLeadingTrivia(trivia), period, name);
        }
        return new MemberAccessExpr(null, period.withLeadingTrivia(trivia), name);
    }

    @Override
    public MemberAccessExpr withTrailingTrivia(String trivia) {
        return new MemberAccessExpr(base, period, name.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        if (base == null) {
            return this;
        }
        Expr newBase = transform.apply(base);
        return newBase == base ? this : new MemberAccessExpr(newBase, period, name);
    }
}
