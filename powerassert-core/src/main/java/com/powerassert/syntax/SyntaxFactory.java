package com.powerassert.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Typed constructors for tokens and expression nodes, with conventional spacing: a
 * single space around binary operators and after commas and argument-label colons.
 *
 * <p>Every call creates fresh tokens, so trees assembled from factory calls never share
 * a node instance between two positions.</p>
 */
public final class SyntaxFactory {

    private SyntaxFactory() {
        // Utility class
    }

    // ==================== Tokens ====================

    public static Token token(TokenKind kind, String text) {
        return new Token(kind, text);
    }

    public static Token period() {
        return new Token(TokenKind.PERIOD, ".");
    }

    public static Token comma() {
        return new Token(TokenKind.COMMA, ",", "", " ");
    }

    public static Token colon() {
        return new Token(TokenKind.COLON, ":", "", " ");
    }

    public static Token leftParen() {
        return new Token(TokenKind.LEFT_PAREN, "(");
    }

    public static Token rightParen() {
        return new Token(TokenKind.RIGHT_PAREN, ")");
    }

    // ==================== Literals and names ====================

    public static LiteralExpr integerLiteral(long value) {
        return new LiteralExpr(new Token(TokenKind.INTEGER_LITERAL, Long.toString(value)));
    }

    public static LiteralExpr floatLiteral(String digits) {
        return new LiteralExpr(new Token(TokenKind.FLOAT_LITERAL, digits));
    }

    /**
     * String literal; {@code contents} is emitted between double quotes as-is.
     */
    public static LiteralExpr stringLiteral(String contents) {
        return new LiteralExpr(new Token(TokenKind.STRING_LITERAL, "\"" + contents + "\""));
    }

    public static LiteralExpr booleanLiteral(boolean value) {
        return new LiteralExpr(new Token(TokenKind.KEYWORD, Boolean.toString(value)));
    }

    public static LiteralExpr nilLiteral() {
        return new LiteralExpr(new Token(TokenKind.KEYWORD, "nil"));
    }

    public static IdentifierExpr identifier(String name) {
        return new IdentifierExpr(new Token(TokenKind.IDENTIFIER, name));
    }

    // ==================== Postfix chains ====================

    public static MemberAccessExpr memberAccess(Expr base, String name) {
        return new MemberAccessExpr(base, period(), new Token(TokenKind.IDENTIFIER, name));
    }

    public static MemberAccessExpr implicitMember(String name) {
        return new MemberAccessExpr(null, period(), new Token(TokenKind.IDENTIFIER, name));
    }

    public static OptionalChainingExpr optionalChaining(Expr expression) {
        return new OptionalChainingExpr(expression, new Token(TokenKind.POSTFIX_QUESTION_MARK, "?"));
    }

    public static ForceUnwrapExpr forceUnwrap(Expr expression) {
        return new ForceUnwrapExpr(expression, new Token(TokenKind.EXCLAMATION_MARK, "!"));
    }

    public static CallExpr call(Expr callee, Expr... arguments) {
        return call(callee, elements(Arrays.asList(arguments)));
    }

    public static CallExpr call(Expr callee, List<ListElement> arguments) {
        return new CallExpr(callee, leftParen(), arguments, rightParen());
    }

    public static CallExpr call(Expr callee, List<ListElement> arguments, ClosureExpr trailingClosure) {
        return new CallExpr(callee, leftParen(), arguments, rightParen().withTrailingTrivia(" "), trailingClosure);
    }

    public static SubscriptExpr subscript(Expr callee, Expr... arguments) {
        return new SubscriptExpr(
            callee,
            new Token(TokenKind.LEFT_SQUARE, "["),
            elements(Arrays.asList(arguments)),
            new Token(TokenKind.RIGHT_SQUARE, "]"));
    }

    /**
     * Unlabelled list elements separated by commas.
     */
    public static List<ListElement> elements(List<? extends Expr> expressions) {
        List<ListElement> elements = new ArrayList<>(expressions.size());
        for (int i = 0; i < expressions.size(); i++) {
            Token comma = i < expressions.size() - 1 ? comma() : null;
            elements.add(new ListElement(null, null, expressions.get(i), comma));
        }
        return elements;
    }

    /**
     * A labelled element, {@code label: expression}, without a trailing comma.
     */
    public static ListElement labeledElement(String label, Expr expression) {
        return new ListElement(new Token(TokenKind.IDENTIFIER, label), colon(), expression, null);
    }

    // ==================== Operators ====================

    public static PrefixOperatorExpr prefixOperator(String operator, Expr operand) {
        return new PrefixOperatorExpr(new Token(TokenKind.PREFIX_OPERATOR, operator), operand);
    }

    /**
     * Binary operator element for a sequence, spaced on both sides.
     */
    public static BinaryOperatorExpr binaryOperator(String operator) {
        return new BinaryOperatorExpr(new Token(TokenKind.BINARY_OPERATOR, operator, " ", " "));
    }

    /**
     * Unattached prefix operator element for a sequence, as in {@code a + -b}.
     */
    public static BinaryOperatorExpr prefixOperatorElement(String operator) {
        return new BinaryOperatorExpr(new Token(TokenKind.PREFIX_OPERATOR, operator));
    }

    /**
     * Unattached postfix operator element for a sequence, as in {@code a! + b}.
     */
    public static BinaryOperatorExpr postfixOperatorElement(String operator) {
        return new BinaryOperatorExpr(new Token(TokenKind.POSTFIX_OPERATOR, operator));
    }

    public static UnresolvedTernaryExpr ternaryElement(Expr firstChoice) {
        return new UnresolvedTernaryExpr(
            new Token(TokenKind.INFIX_QUESTION_MARK, "?", " ", " "),
            firstChoice,
            new Token(TokenKind.COLON, ":", " ", " "));
    }

    public static SequenceExpr sequence(Expr... elements) {
        return new SequenceExpr(Arrays.asList(elements));
    }

    public static InfixOperatorExpr infixOperator(Expr left, String operator, Expr right) {
        return new InfixOperatorExpr(left, binaryOperator(operator), right);
    }

    public static TernaryExpr ternary(Expr condition, Expr firstChoice, Expr secondChoice) {
        return new TernaryExpr(
            condition,
            new Token(TokenKind.INFIX_QUESTION_MARK, "?", " ", " "),
            firstChoice,
            new Token(TokenKind.COLON, ":", " ", " "),
            secondChoice);
    }

    // ==================== Collections ====================

    public static TupleExpr tuple(Expr... elements) {
        return new TupleExpr(leftParen(), elements(Arrays.asList(elements)), rightParen());
    }

    public static TupleExpr parenthesized(Expr expression) {
        return tuple(expression);
    }

    public static ArrayExpr array(Expr... elements) {
        return new ArrayExpr(
            new Token(TokenKind.LEFT_SQUARE, "["),
            elements(Arrays.asList(elements)),
            new Token(TokenKind.RIGHT_SQUARE, "]"));
    }

    /**
     * Dictionary literal from alternating keys and values; no arguments yields {@code [:]}.
     */
    public static DictionaryExpr dictionary(Expr... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating keys and values, got " + keysAndValues.length);
        }
        Token leftSquare = new Token(TokenKind.LEFT_SQUARE, "[");
        Token rightSquare = new Token(TokenKind.RIGHT_SQUARE, "]");
        if (keysAndValues.length == 0) {
            return new DictionaryExpr(leftSquare, List.of(), new Token(TokenKind.COLON, ":"), rightSquare);
        }
        List<DictionaryElement> elements = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Token comma = i + 2 < keysAndValues.length ? comma() : null;
            elements.add(new DictionaryElement(keysAndValues[i], colon(), keysAndValues[i + 1], comma));
        }
        return new DictionaryExpr(leftSquare, elements, null, rightSquare);
    }

    /**
     * Key path {@code \Root.a.b}; pass an empty root for {@code \.a.b}.
     */
    public static KeyPathExpr keyPath(String root, String... path) {
        List<Token> components = new ArrayList<>();
        if (!root.isEmpty()) {
            components.add(new Token(TokenKind.IDENTIFIER, root));
        }
        for (String name : path) {
            components.add(period());
            components.add(new Token(TokenKind.IDENTIFIER, name));
        }
        return new KeyPathExpr(new Token(TokenKind.BACKSLASH, "\\"), components);
    }

    public static MacroExpansionExpr macroExpansion(String name, Expr... arguments) {
        return new MacroExpansionExpr(
            new Token(TokenKind.POUND, "#"),
            new Token(TokenKind.IDENTIFIER, name),
            leftParen(),
            elements(Arrays.asList(arguments)),
            rightParen());
    }

    /**
     * Closure whose body is a single opaque token of source text, {@code { body }}.
     */
    public static ClosureExpr closure(String body) {
        return closure(new Token(TokenKind.OTHER, body));
    }

    public static ClosureExpr closure(Syntax... body) {
        return new ClosureExpr(
            new Token(TokenKind.LEFT_BRACE, "{", "", " "),
            Arrays.asList(body),
            new Token(TokenKind.RIGHT_BRACE, "}", " ", ""));
    }
}
