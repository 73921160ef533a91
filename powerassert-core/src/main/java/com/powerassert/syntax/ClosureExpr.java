package com.powerassert.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code { body }}. The body is kept as an opaque list of elements and is never
 * transformed.
 */
public record ClosureExpr(
    Token leftBrace,
    List<Syntax> body,
    Token rightBrace
) implements Expr {
    public ClosureExpr {
        body = List.copyOf(body);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.CLOSURE;
    }

    @Override
    public List<Syntax> children() {
        List<Syntax> children = new ArrayList<>(body.size() + 2);
        children.add(leftBrace);
        children.addAll(body);
        children.add(rightBrace);
        return List.copyOf(children);
    }

    @Override
    public ClosureExpr withLeadingTrivia(String trivia) {
        return new ClosureExpr(leftBrace.withLeadingTrivia(trivia), body, rightBrace);
    }

    @Override
    public ClosureExpr withTrailingTrivia(String trivia) {
        return new ClosureExpr(leftBrace, body, rightBrace.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        return this;
    }
}
