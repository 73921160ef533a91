package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A binary operation produced by precedence folding.
 */
public record InfixOperatorExpr(
    Expr leftOperand,
    BinaryOperatorExpr operator,
    Expr rightOperand
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.INFIX_OPERATOR;
    }

    @Override
    public List<Syntax> children() {
        return List.of(leftOperand, operator, rightOperand);
    }

    @Override
    public InfixOperatorExpr withLeadingTrivia(String trivia) {
        return new InfixOperatorExpr(leftOperand.withLeadingTrivia(trivia), operator, rightOperand);
    }

    @Override
    public InfixOperatorExpr withTrailingTrivia(String trivia) {
        return new InfixOperatorExpr(leftOperand, operator, rightOperand.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newLeft = transform.apply(leftOperand);
        Expr newRight = transform.apply(rightOperand);
        if (newLeft == leftOperand && newRight == rightOperand) {
            return this;
        }
        return new InfixOperatorExpr(newLeft, operator, newRight);
    }
}
