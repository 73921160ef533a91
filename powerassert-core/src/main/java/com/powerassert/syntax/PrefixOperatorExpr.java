package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

public record PrefixOperatorExpr(
    Token operator,
    Expr operand
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.PREFIX_OPERATOR;
    }

    @Override
    public List<Syntax> children() {
        return List.of(operator, operand);
    }

    @Override
    public PrefixOperatorExpr withLeadingTrivia(String trivia) {
        return new PrefixOperatorExpr(operator.withLeadingTrivia(trivia), operand);
    }

    @Override
    public PrefixOperatorExpr withTrailingTrivia(String trivia) {
        return new PrefixOperatorExpr(operator, operand.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newOperand = transform.apply(operand);
        return newOperand == operand ? this : new PrefixOperatorExpr(operator, newOperand);
    }
}
