package com.powerassert.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code [key: value, ...]}. The empty dictionary {@code [:]} has no elements and carries
 * its lone colon in {@code emptyColon}.
 */
public record DictionaryExpr(
    Token leftSquare,
    List<DictionaryElement> elements,
    Token emptyColon,
    Token rightSquare
) implements Expr {
    public DictionaryExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.DICTIONARY;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(leftSquare, elements, emptyColon, rightSquare);
    }

    @Override
    public DictionaryExpr withLeadingTrivia(String trivia) {
        return new DictionaryExpr(leftSquare.withLeadingTrivia(trivia), elements, emptyColon, rightSquare);
    }

    @Override
    public DictionaryExpr withTrailingTrivia(String trivia) {
        return new DictionaryExpr(leftSquare, elements, emptyColon, rightSquare.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        List<DictionaryElement> mapped = new ArrayList<>(elements.size());
        boolean changed = false;
        for (DictionaryElement element : elements) {
            DictionaryElement newElement = element.mapExpressions(transform);
            changed |= newElement != element;
            mapped.add(newElement);
        }
        return changed ? new DictionaryExpr(leftSquare, mapped, emptyColon, rightSquare) : this;
    }
}
