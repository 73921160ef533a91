package com.powerassert.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * One element of an argument, tuple or array list: {@code label: expression,}. Label,
 * colon and trailing comma are each optional.
 */
public record ListElement(
    Token label,
    Token colon,
    Expr expression,
    Token trailingComma
) implements Syntax {
    @Override
    public List<Syntax> children() {
        return Children.of(label, colon, expression, trailingComma);
    }

    public ListElement withExpression(Expr newExpression) {
        return new ListElement(label, colon, newExpression, trailingComma);
    }

    /**
     * Maps the expression of every element, returning {@code elements} itself when no
     * expression changed.
     */
    static List<ListElement> mapExpressions(List<ListElement> elements, UnaryOperator<Expr> transform) {
        List<ListElement> mapped = new ArrayList<>(elements.size());
        boolean changed = false;
        for (ListElement element : elements) {
            Expr newExpression = transform.apply(element.expression());
            if (newExpression != element.expression()) {
                changed = true;
                mapped.add(element.withExpression(newExpression));
            } else {
                mapped.add(element);
            }
        }
        return changed ? mapped : elements;
    }
}
