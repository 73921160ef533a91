package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

public record DictionaryElement(
    Expr key,
    Token colon,
    Expr value,
    Token trailingComma
) implements Syntax {
    @Override
    public List<Syntax> children() {
        return Children.of(key, colon, value, trailingComma);
    }

    DictionaryElement mapExpressions(UnaryOperator<Expr> transform) {
        Expr newKey = transform.apply(key);
        Expr newValue = transform.apply(value);
        if (newKey == key && newValue == value) {
            return this;
        }
        return new DictionaryElement(newKey, colon, newValue, trailingComma);
    }
}
