package com.powerassert.operators;

import com.powerassert.syntax.Expr;
import com.powerassert.syntax.SequenceExpr;

/**
 * Outcome of folding one sequence: the folded tree, or the original flat sequence with
 * the reason folding gave up.
 */
public sealed interface FoldResult permits FoldResult.Folded, FoldResult.Unfolded {

    Expr expression();

    boolean folded();

    record Folded(Expr expression) implements FoldResult {
        @Override
        public boolean folded() {
            return true;
        }
    }

    record Unfolded(SequenceExpr expression, String reason) implements FoldResult {
        @Override
        public boolean folded() {
            return false;
        }
    }
}
