package com.powerassert.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Flat, unassociated run of operands and operators as a parser produces it before
 * operator precedence is known: {@code operand (operator operand)*}.
 */
public record SequenceExpr(
    List<Expr> elements
) implements Expr {
    public SequenceExpr {
        elements = List.copyOf(elements);
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Sequence must have at least one element");
        }
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SEQUENCE;
    }

    @Override
    public List<Syntax> children() {
        return List.copyOf(elements);
    }

    @Override
    public SequenceExpr withLeadingTrivia(String trivia) {
        List<Expr> copy = new ArrayList<>(elements);
        copy.set(0, copy.get(0).withLeadingTrivia(trivia));
        return new SequenceExpr(copy);
    }

    @Override
    public SequenceExpr withTrailingTrivia(String trivia) {
        List<Expr> copy = new ArrayList<>(elements);
        int last = copy.size() - 1;
        copy.set(last, copy.get(last).withTrailingTrivia(trivia));
        return new SequenceExpr(copy);
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        List<Expr> mapped = new ArrayList<>(elements.size());
        boolean changed = false;
        for (Expr element : elements) {
            Expr newElement = transform.apply(element);
            changed |= newElement != element;
            mapped.add(newElement);
        }
        return changed ? new SequenceExpr(mapped) : this;
    }
}
