package com.powerassert.syntax;

import java.util.List;
import java.util.function.UnaryOperator;

public record TernaryExpr(
    Expr condition,
    Token questionMark,
    Expr firstChoice,
    Token colon,
    Expr secondChoice
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.TERNARY;
    }

    @Override
    public List<Syntax> children() {
        return List.of(condition, questionMark, firstChoice, colon, secondChoice);
    }

    @Override
    public TernaryExpr withLeadingTrivia(String trivia) {
        return new TernaryExpr(condition.withLeadingTrivia(trivia), questionMark, firstChoice, colon, secondChoice);
    }

    @Override
    public TernaryExpr withTrailingTrivia(String trivia) {
        return new TernaryExpr(condition, questionMark, firstChoice, colon, secondChoice.withTrailingTrivia(trivia));
    }

    @Override
    public Expr mapChildren(UnaryOperator<Expr> transform) {
        Expr newCondition = transform.apply(condition);
        Expr newFirst = transform.apply(firstChoice);
        Expr newSecond = transform.apply(secondChoice);
        if (newCondition == condition && newFirst == firstChoice && newSecond == secondChoice) {
            return this;
        }
        return new TernaryExpr(newCondition, questionMark, newFirst, colon, newSecond);
    }
}
