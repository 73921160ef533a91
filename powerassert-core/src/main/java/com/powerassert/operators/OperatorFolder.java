package com.powerassert.operators;

import com.powerassert.syntax.BinaryOperatorExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.ForceUnwrapExpr;
import com.powerassert.syntax.InfixOperatorExpr;
import com.powerassert.syntax.PrefixOperatorExpr;
import com.powerassert.syntax.SequenceExpr;
import com.powerassert.syntax.TernaryExpr;
import com.powerassert.syntax.Token;
import com.powerassert.syntax.TokenKind;
import com.powerassert.syntax.UnresolvedTernaryExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns flat operand/operator sequences into nested operator trees.
 *
 * <p>Folding is precedence climbing over the sequence elements: an operand (with any
 * prefix operators in front of it and postfix {@code !} after it), then, while the next
 * operator binds at least as tightly as the current minimum, the operator and its right
 * operand parsed at the operator's own binding power (right associative) or one above
 * it (left and non-associative).</p>
 *
 * <p>Folding is best effort. A sequence that cannot be folded is returned unchanged as
 * {@link FoldResult.Unfolded}.</p>
 */
public final class OperatorFolder {

    private static final Logger logger = LoggerFactory.getLogger(OperatorFolder.class);

    private static final int BP_NONE = 0;

    private final OperatorTable operators;

    public OperatorFolder(OperatorTable operators) {
        this.operators = Objects.requireNonNull(operators, "operators");
    }

    public FoldResult fold(SequenceExpr sequence) {
        try {
            Cursor cursor = new Cursor(sequence.elements());
            Expr folded = parseExpr(cursor, BP_NONE);
            if (cursor.hasNext()) {
                throw new FoldFailure("Unexpected " + describe(cursor.peek()) + " after a complete expression");
            }
            return new FoldResult.Folded(folded);
        } catch (FoldFailure e) {
            logger.debug("Leaving sequence `{}` unfolded: {}", sequence.toSource().strip(), e.getMessage());
            return new FoldResult.Unfolded(sequence, e.getMessage());
        }
    }

    /**
     * Folds every sequence in the tree, innermost first. A sequence that fails to fold
     * stays flat (with its operands still folded); closures are not entered. Returns the
     * same instance when the tree holds no sequence.
     */
    public Expr foldAll(Expr expression) {
        Expr withFoldedChildren = expression.mapChildren(this::foldAll);
        if (withFoldedChildren instanceof SequenceExpr sequence) {
            return fold(sequence).expression();
        }
        return withFoldedChildren;
    }

    private Expr parseExpr(Cursor cursor, int minBp) {
        Expr left = parseOperand(cursor);
        PrecedenceGroup previous = null;
        while (cursor.hasNext()) {
            Expr operator = cursor.peek();
            PrecedenceGroup group = infixGroupOf(operator);
            if (group.bindingPower() < minBp) {
                break;
            }
            if (group.associativity() == Associativity.NONE && group.equals(previous)) {
                throw new FoldFailure("Adjacent operators in non-associative group " + group.name());
            }
            cursor.next();
            int rightBp = group.associativity() == Associativity.RIGHT
                ? group.bindingPower()
                : group.bindingPower() + 1;
            Expr right = parseExpr(cursor, rightBp);
            left = combine(left, operator, right);
            previous = group;
        }
        return left;
    }

    private Expr parseOperand(Cursor cursor) {
        if (!cursor.hasNext()) {
            throw new FoldFailure("Sequence ends with an operator");
        }
        Expr element = cursor.next();
        if (element instanceof BinaryOperatorExpr prefix) {
            Token token = prefix.operator();
            if (token.kind() == TokenKind.PREFIX_OPERATOR && operators.isPrefixOperator(token.text())) {
                return new PrefixOperatorExpr(token, parseOperand(cursor));
            }
            throw new FoldFailure("Expected an operand but found " + describe(element));
        }
        if (element instanceof UnresolvedTernaryExpr) {
            throw new FoldFailure("Expected an operand but found " + describe(element));
        }
        Expr operand = element;
        while (cursor.hasNext() && cursor.peek() instanceof BinaryOperatorExpr postfix
                && postfix.operator().kind() == TokenKind.POSTFIX_OPERATOR) {
            Token token = postfix.operator();
            if (!"!".equals(token.text()) || !operators.isPostfixOperator(token.text())) {
                throw new FoldFailure("Unsupported postfix operator `" + token.text() + "`");
            }
            cursor.next();
            operand = new ForceUnwrapExpr(operand,
                new Token(TokenKind.EXCLAMATION_MARK, "!", token.leadingTrivia(), token.trailingTrivia()));
        }
        return operand;
    }

    private PrecedenceGroup infixGroupOf(Expr element) {
        if (element instanceof UnresolvedTernaryExpr) {
            return PrecedenceGroup.TERNARY;
        }
        if (element instanceof BinaryOperatorExpr binary) {
            Token token = binary.operator();
            if (token.kind() != TokenKind.BINARY_OPERATOR) {
                throw new FoldFailure("Expected an infix operator but found " + describe(element));
            }
            return operators.infixGroup(token.text())
                .orElseThrow(() -> new FoldFailure("Unknown infix operator `" + token.text() + "`"));
        }
        throw new FoldFailure("Expected an operator but found " + describe(element));
    }

    private static Expr combine(Expr left, Expr operator, Expr right) {
        if (operator instanceof UnresolvedTernaryExpr ternary) {
            return new TernaryExpr(left, ternary.questionMark(), ternary.firstChoice(), ternary.colon(), right);
        }
        return new InfixOperatorExpr(left, (BinaryOperatorExpr) operator, right);
    }

    private static String describe(Expr element) {
        return element.kind().name().toLowerCase(Locale.ROOT) + " `" + element.toSource().strip() + "`";
    }

    private static final class Cursor {
        private final List<Expr> elements;
        private int position;

        Cursor(List<Expr> elements) {
            this.elements = elements;
        }

        boolean hasNext() {
            return position < elements.size();
        }

        Expr peek() {
            return elements.get(position);
        }

        Expr next() {
            return elements.get(position++);
        }
    }

    private static final class FoldFailure extends RuntimeException {
        FoldFailure(String message) {
            super(message, null, false, false);
        }
    }
}
