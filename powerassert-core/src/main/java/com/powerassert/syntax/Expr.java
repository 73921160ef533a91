package com.powerassert.syntax;

import java.util.function.UnaryOperator;

/**
 * Base interface for expression nodes.
 */
public sealed interface Expr extends Syntax permits
    LiteralExpr,
    IdentifierExpr,
    MemberAccessExpr,
    SubscriptExpr,
    CallExpr,
    PrefixOperatorExpr,
    ForceUnwrapExpr,
    OptionalChainingExpr,
    BinaryOperatorExpr,
    InfixOperatorExpr,
    SequenceExpr,
    UnresolvedTernaryExpr,
    TernaryExpr,
    TupleExpr,
    ArrayExpr,
    DictionaryExpr,
    KeyPathExpr,
    MacroExpansionExpr,
    ClosureExpr {

    ExprKind kind();

    Expr withLeadingTrivia(String trivia);

    Expr withTrailingTrivia(String trivia);

    /**
     * Applies {@code transform} to every expression directly nested in this node,
     * including those held by list and dictionary elements, and rebuilds the node
     * around the results. Returns {@code this} when every child came back unchanged.
     * Closures (bodies and trailing closures) are never handed to the transform.
     */
    Expr mapChildren(UnaryOperator<Expr> transform);
}
