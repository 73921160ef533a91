package com.powerassert.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code \Root.path.to.value}, kept as its raw component tokens.
 */
public record KeyPathExpr(
    Token backslash,
    List<Token> components
) implements Expr {
    public KeyPathExpr {
        components = List.copyOf(components);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.KEY_PATH;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(backslash, components);
    }

    @Override
    public KeyPathExpr withLeadingTrivia(String trivia) {
        return new KeyPathExpr(backslash.withLeadingTrivia(trivia), components);
    }

    @Override
    public KeyPathExpr withTrailingTrivia(String trivia) {
        if (components.isEmpty()) {
            return new KeyPathExpr(backslash.withTrailingTrivia(trivia), components);
        }
        List<Token> copy = new ArrayList<>(components);
        int last = copy.size() - 1;
        copy.set(last, copy.get(last).withTrailingTrivia(trivia));
        return new KeyPathExpr(backslash, copy);
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        return this;
    }
}
