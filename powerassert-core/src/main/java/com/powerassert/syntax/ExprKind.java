package com.powerassert.syntax;

/**
 * Closed set of expression kinds. Every {@link Expr} reports exactly one.
 */
public enum ExprKind {
    LITERAL,
    IDENTIFIER,
    MEMBER_ACCESS,
    SUBSCRIPT,
    CALL,
    PREFIX_OPERATOR,
    FORCE_UNWRAP,
    OPTIONAL_CHAINING,
    // operator element of an unfolded sequence
    BINARY_OPERATOR,
    INFIX_OPERATOR,
    SEQUENCE,
    // `? x :` element of an unfolded sequence
    UNRESOLVED_TERNARY,
    TERNARY,
    TUPLE,
    ARRAY,
    DICTIONARY,
    KEY_PATH,
    MACRO_EXPANSION,
    CLOSURE
}
