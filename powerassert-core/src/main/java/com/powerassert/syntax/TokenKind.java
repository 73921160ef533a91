package com.powerassert.syntax;

public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    BINARY_OPERATOR,
    PREFIX_OPERATOR,
    POSTFIX_OPERATOR,
    PERIOD,
    COMMA,
    COLON,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_SQUARE,
    RIGHT_SQUARE,
    LEFT_BRACE,
    RIGHT_BRACE,
    // `?` directly after an operand: optional chaining
    POSTFIX_QUESTION_MARK,
    // `?` of a ternary
    INFIX_QUESTION_MARK,
    EXCLAMATION_MARK,
    BACKSLASH,
    POUND,
    OTHER
}
