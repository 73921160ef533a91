package com.powerassert;

import com.powerassert.syntax.CallExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.IdentifierExpr;
import com.powerassert.syntax.ListElement;
import com.powerassert.syntax.LiteralExpr;
import com.powerassert.syntax.MemberAccessExpr;
import com.powerassert.syntax.OptionalChainingExpr;
import com.powerassert.syntax.SyntaxFactory;
import com.powerassert.syntax.Token;
import com.powerassert.syntax.TokenKind;

import java.util.List;
import java.util.Objects;

/**
 * Builds the capture calls that wrap instrumented subexpressions.
 *
 * <p>A wrapped node evaluates to the original value; the sink records it together with
 * the column as a side effect. The node's own trivia moves to the outside of the call
 * so the surrounding formatting is unchanged.</p>
 */
public final class CaptureCallSynthesizer {

    private final CaptureSink sink;

    public CaptureCallSynthesizer(CaptureSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CallExpr wrap(Expr node, int column) {
        Expr bare = node.withLeadingTrivia("").withTrailingTrivia("");

        Expr callee;
        if (sink.receiver().isEmpty()) {
            callee = new IdentifierExpr(new Token(TokenKind.IDENTIFIER, sink.function(), node.leadingTrivia(), ""));
        } else {
            callee = new MemberAccessExpr(
                new IdentifierExpr(new Token(TokenKind.IDENTIFIER, sink.receiver(), node.leadingTrivia(), "")),
                SyntaxFactory.period(),
                new Token(TokenKind.IDENTIFIER, sink.function()));
        }

        LiteralExpr columnLiteral = new LiteralExpr(new Token(TokenKind.INTEGER_LITERAL, Integer.toString(column)));
        ListElement columnArgument = sink.columnLabel() != null
            ? SyntaxFactory.labeledElement(sink.columnLabel(), columnLiteral)
            : new ListElement(null, null, columnLiteral, null);

        return new CallExpr(
            callee,
            SyntaxFactory.leftParen(),
            List.of(new ListElement(null, null, bare, SyntaxFactory.comma()), columnArgument),
            SyntaxFactory.rightParen().withTrailingTrivia(node.trailingTrivia()));
    }

    /**
     * {@code name.self}: a reference that is valid both for values and for type names.
     */
    public MemberAccessExpr selfReference(IdentifierExpr identifier) {
        return new MemberAccessExpr(
            identifier.withTrailingTrivia(""),
            SyntaxFactory.period(),
            new Token(TokenKind.KEYWORD, "self", "", identifier.trailingTrivia()));
    }

    /**
     * Re-appends an optional-chaining marker after a capture call, so the chain keeps
     * short-circuiting on nil. Trailing trivia moves past the marker.
     */
    public OptionalChainingExpr reattachOptionalChain(CallExpr capture, Token marker) {
        return new OptionalChainingExpr(
            capture.withTrailingTrivia(""),
            new Token(TokenKind.POSTFIX_QUESTION_MARK, marker.text(), "", capture.trailingTrivia()));
    }
}
