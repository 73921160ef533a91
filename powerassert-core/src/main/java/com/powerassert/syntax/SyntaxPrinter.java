package com.powerassert.syntax;

/**
 * Re-emits source text from a syntax tree. Output is the concatenation, in order, of
 * every token's leading trivia, text and trailing trivia, so printing an unmodified
 * tree reproduces its source exactly.
 */
public final class SyntaxPrinter {

    private SyntaxPrinter() {
        // Utility class
    }

    public static String print(Syntax syntax) {
        StringBuilder sb = new StringBuilder();
        append(syntax, sb);
        return sb.toString();
    }

    private static void append(Syntax syntax, StringBuilder sb) {
        if (syntax instanceof Token token) {
            sb.append(token.leadingTrivia()).append(token.text()).append(token.trailingTrivia());
            return;
        }
        for (Syntax child : syntax.children()) {
            append(child, sb);
        }
    }
}
