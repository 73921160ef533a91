package com.powerassert.syntax;

import java.util.List;

/**
 * Base interface for every element of a syntax tree.
 *
 * <p>Trees are lossless: every character of the source, including whitespace and
 * comments, is held by a {@link Token} as text or trivia. A node's own trivia is the
 * leading trivia of its first token and the trailing trivia of its last token.</p>
 */
public sealed interface Syntax permits Token, Expr, ListElement, DictionaryElement {

    /**
     * Returns the direct children of this element in source order.
     */
    List<Syntax> children();

    default Token firstToken() {
        for (Syntax child : children()) {
            Token token = child.firstToken();
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    default Token lastToken() {
        List<Syntax> children = children();
        for (int i = children.size() - 1; i >= 0; i--) {
            Token token = children.get(i).lastToken();
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    default String leadingTrivia() {
        Token token = firstToken();
        return token != null ? token.leadingTrivia() : "";
    }

    default String trailingTrivia() {
        Token token = lastToken();
        return token != null ? token.trailingTrivia() : "";
    }

    /**
     * Re-emits the source text this element covers, trivia included.
     */
    default String toSource() {
        return SyntaxPrinter.print(this);
    }
}
