package com.powerassert.operators;

import com.powerassert.syntax.CallExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.ForceUnwrapExpr;
import com.powerassert.syntax.InfixOperatorExpr;
import com.powerassert.syntax.PrefixOperatorExpr;
import com.powerassert.syntax.SequenceExpr;
import com.powerassert.syntax.TernaryExpr;
import com.powerassert.syntax.TupleExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powerassert.syntax.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class OperatorFolderTest {

    private final OperatorFolder folder = new OperatorFolder(OperatorTable.standardOperators());

    private Expr foldOrFail(SequenceExpr sequence) {
        FoldResult result = folder.fold(sequence);
        assertTrue(result.folded(), () -> "Expected `" + sequence.toSource() + "` to fold");
        assertEquals(sequence.toSource(), result.expression().toSource(), "Folding must not change the source text");
        return result.expression();
    }

    private static String operatorOf(Expr expression) {
        return ((InfixOperatorExpr) expression).operator().operator().text();
    }

    @Test
    void testMultiplicationBindsTighter() {
        Expr folded = foldOrFail(sequence(
            integerLiteral(1), binaryOperator("+"), integerLiteral(2), binaryOperator("*"), integerLiteral(3)));

        InfixOperatorExpr sum = assertInstanceOf(InfixOperatorExpr.class, folded);
        assertEquals("+", operatorOf(sum));
        assertEquals("1", sum.leftOperand().toSource());
        assertEquals("*", operatorOf(sum.rightOperand()));
    }

    @Test
    void testLeftAssociativity() {
        InfixOperatorExpr folded = (InfixOperatorExpr) foldOrFail(sequence(
            identifier("a"), binaryOperator("-"), identifier("b"), binaryOperator("-"), identifier("c")));

        assertEquals("a - b", folded.leftOperand().toSource());
        assertEquals("c", folded.rightOperand().toSource());
    }

    @Test
    void testRightAssociativity() {
        InfixOperatorExpr folded = (InfixOperatorExpr) foldOrFail(sequence(
            identifier("a"), binaryOperator("??"), identifier("b"), binaryOperator("??"), identifier("c")));

        assertEquals("a", folded.leftOperand().toSource());
        assertEquals("b ?? c", folded.rightOperand().toSource());
    }

    @Test
    void testMixedPrecedenceLevels() {
        InfixOperatorExpr folded = (InfixOperatorExpr) foldOrFail(sequence(
            identifier("a"), binaryOperator("<"), identifier("b"),
            binaryOperator("&&"),
            identifier("c"), binaryOperator("<"), identifier("d"),
            binaryOperator("||"),
            identifier("e")));

        assertEquals("||", operatorOf(folded));
        InfixOperatorExpr conjunction = (InfixOperatorExpr) folded.leftOperand();
        assertEquals("&&", operatorOf(conjunction));
        assertEquals("<", operatorOf(conjunction.leftOperand()));
        assertEquals("<", operatorOf(conjunction.rightOperand()));
    }

    @Test
    void testTernary() {
        Expr folded = foldOrFail(sequence(
            identifier("a"), binaryOperator("||"), identifier("b"),
            ternaryElement(integerLiteral(1)),
            integerLiteral(2), binaryOperator("+"), integerLiteral(3)));

        TernaryExpr ternary = assertInstanceOf(TernaryExpr.class, folded);
        assertEquals("||", operatorOf(ternary.condition()));
        assertEquals("1", ternary.firstChoice().toSource());
        assertEquals("+", operatorOf(ternary.secondChoice()));
    }

    @Test
    void testNestedTernaryIsRightAssociative() {
        TernaryExpr folded = (TernaryExpr) foldOrFail(sequence(
            identifier("a"), ternaryElement(integerLiteral(1)),
            identifier("b"), ternaryElement(integerLiteral(2)),
            integerLiteral(3)));

        assertEquals("a", folded.condition().toSource());
        assertInstanceOf(TernaryExpr.class, folded.secondChoice());
    }

    @Test
    void testPrefixOperators() {
        InfixOperatorExpr folded = (InfixOperatorExpr) foldOrFail(sequence(
            prefixOperatorElement("-"), identifier("a"), binaryOperator("*"),
            prefixOperatorElement("!"), prefixOperatorElement("-"), identifier("b")));

        PrefixOperatorExpr negated = assertInstanceOf(PrefixOperatorExpr.class, folded.leftOperand());
        assertEquals("-", negated.operator().text());
        PrefixOperatorExpr not = assertInstanceOf(PrefixOperatorExpr.class, folded.rightOperand());
        assertInstanceOf(PrefixOperatorExpr.class, not.operand());
    }

    @Test
    void testPostfixForceUnwrap() {
        InfixOperatorExpr folded = (InfixOperatorExpr) foldOrFail(sequence(
            identifier("a"), postfixOperatorElement("!"), binaryOperator("+"), integerLiteral(1)));

        ForceUnwrapExpr unwrapped = assertInstanceOf(ForceUnwrapExpr.class, folded.leftOperand());
        assertEquals("a", unwrapped.expression().toSource());
    }

    @Test
    void testUnknownOperatorStaysFlat() {
        SequenceExpr sequence = sequence(identifier("a"), binaryOperator("<=>"), identifier("b"));

        FoldResult result = folder.fold(sequence);

        FoldResult.Unfolded unfolded = assertInstanceOf(FoldResult.Unfolded.class, result);
        assertSame(sequence, unfolded.expression());
        assertTrue(unfolded.reason().contains("<=>"), unfolded.reason());
    }

    @Test
    void testCustomOperator() {
        OperatorTable table = OperatorTable.standardOperators()
            .withInfixOperator("<=>", PrecedenceGroup.COMPARISON)
            .withPrefixOperator("√");
        OperatorFolder custom = new OperatorFolder(table);

        FoldResult result = custom.fold(sequence(
            prefixOperatorElement("√"), identifier("a"), binaryOperator("<=>"), identifier("b")));

        assertTrue(result.folded());
        InfixOperatorExpr folded = (InfixOperatorExpr) result.expression();
        assertInstanceOf(PrefixOperatorExpr.class, folded.leftOperand());
        assertFalse(OperatorTable.standardOperators().infixGroup("<=>").isPresent());
    }

    @Test
    void testNonAssociativeChainStaysFlat() {
        FoldResult result = folder.fold(sequence(
            identifier("a"), binaryOperator("=="), identifier("b"), binaryOperator("=="), identifier("c")));

        assertFalse(result.folded());
        assertInstanceOf(SequenceExpr.class, result.expression());
    }

    @Test
    void testMalformedSequences() {
        assertFalse(folder.fold(sequence(identifier("a"), binaryOperator("+"))).folded());
        assertFalse(folder.fold(sequence(identifier("a"), identifier("b"))).folded());
        assertFalse(folder.fold(sequence(binaryOperator("+"), identifier("a"))).folded());
        assertFalse(folder.fold(sequence(prefixOperatorElement("?"), identifier("a"))).folded());
    }

    @Test
    void testEmptyTableFoldsNothing() {
        OperatorFolder bare = new OperatorFolder(OperatorTable.empty());

        assertFalse(bare.fold(sequence(integerLiteral(1), binaryOperator("+"), integerLiteral(2))).folded());
        assertTrue(bare.fold(sequence(identifier("alone"))).folded());
    }

    @Test
    void testFoldAllReachesNestedSequences() {
        CallExpr call = call(identifier("f"),
            sequence(integerLiteral(1), binaryOperator("+"), integerLiteral(2)),
            array(sequence(identifier("x"), binaryOperator("*"), identifier("y"))));

        Expr folded = folder.foldAll(call);

        CallExpr foldedCall = assertInstanceOf(CallExpr.class, folded);
        assertInstanceOf(InfixOperatorExpr.class, foldedCall.arguments().get(0).expression());
        assertEquals(call.toSource(), folded.toSource());
    }

    @Test
    void testFoldAllIsIdempotent() {
        Expr once = folder.foldAll(sequence(identifier("a"), binaryOperator("+"), identifier("b")));

        assertSame(once, folder.foldAll(once));
    }

    @Test
    void testFoldAllDoesNotEnterClosures() {
        CallExpr call = call(identifier("check"), List.of(),
            closure(sequence(identifier("x"), binaryOperator("+"), identifier("y"))));

        assertSame(call, folder.foldAll(call));
    }

    @Test
    void testFoldAllKeepsUnfoldableSequenceWithFoldedOperands() {
        SequenceExpr inner = sequence(integerLiteral(1), binaryOperator("+"), integerLiteral(2));
        Expr folded = folder.foldAll(sequence(
            identifier("a"), binaryOperator("<=>"), tuple(inner)));

        SequenceExpr flat = assertInstanceOf(SequenceExpr.class, folded);
        assertEquals("a <=> (1 + 2)", flat.toSource());
        assertNotSame(inner, ((TupleExpr) flat.elements().get(2)).elements().get(0).expression());
    }
}
