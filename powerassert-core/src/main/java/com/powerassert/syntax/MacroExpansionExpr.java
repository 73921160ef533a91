package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A freestanding macro invocation, {@code #name(arguments)}. Both parentheses are null
 * when the invocation has no argument list.
 */
public record MacroExpansionExpr(
    Token pound,
    Token macroName,
    Token leftParen,
    List<ListElement> arguments,
    Token rightParen
) implements Expr {
    public MacroExpansionExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.MACRO_EXPANSION;
    }

    @Override
    public List<Syntax> children() {
        return Children.of(pound, macroName, leftParen, arguments, rightParen);
    }

    @Override
    public MacroExpansionExpr withLeadingTrivia(String trivia) {
        return new MacroExpansionExpr(pound.withLeadingTrivia(trivia), macroName, leftParen, arguments, rightParen);
    }

    @Override
    public MacroExpansionExpr withTrailingTrivia(String trivia) {
        if (rightParen == null) {
            return new MacroExpansionExpr(pound, macroName.withTrailingTrivia(trivia), leftParen, arguments, null);
        }
        return new MacroExpansionExpr(pound, macroName, leftParen, arguments, rightParen.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        List<ListElement> newArguments = ListElement.mapExpressions(arguments, transform);
        return newArguments == arguments ? this : new MacroExpansionExpr(pound, macroName, leftParen, newArguments, rightParen);
    }
}
