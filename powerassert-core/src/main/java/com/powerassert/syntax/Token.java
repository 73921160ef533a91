package com.powerassert.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A leaf of the syntax tree. Trivia (whitespace, comments) is attached to the token
 * it precedes or follows and never affects evaluation.
 */
public record Token(
    TokenKind kind,
    String text,
    String leadingTrivia,
    String trailingTrivia
) implements Syntax {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        leadingTrivia = leadingTrivia != null ? leadingTrivia : "";
        trailingTrivia = trailingTrivia != null ? trailingTrivia : "";
    }

    public Token(TokenKind kind, String text) {
        this(kind, text, "", "");
    }

    public Token withLeadingTrivia(String trivia) {
        return new Token(kind, text, trivia, trailingTrivia);
    }

    public Token withTrailingTrivia(String trivia) {
        return new Token(kind, text, leadingTrivia, trivia);
    }

    @Override
    public List<Syntax> children() {
        return List.of();
    }

    @Override
    public Token firstToken() {
        return this;
    }

    @Override
    public Token lastToken() {
        return this;
    }
}
