package com.powerassert;

import com.powerassert.columns.DisplayColumnCalculator;
import com.powerassert.operators.OperatorFolder;
import com.powerassert.operators.OperatorTable;
import com.powerassert.syntax.BinaryOperatorExpr;
import com.powerassert.syntax.CallExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.IdentifierExpr;
import com.powerassert.syntax.InfixOperatorExpr;
import com.powerassert.syntax.ListElement;
import com.powerassert.syntax.MacroExpansionExpr;
import com.powerassert.syntax.MemberAccessExpr;
import com.powerassert.syntax.OptionalChainingExpr;
import com.powerassert.syntax.SequenceExpr;
import com.powerassert.syntax.SourceLocationConverter;
import com.powerassert.syntax.SubscriptExpr;
import com.powerassert.syntax.Syntax;
import com.powerassert.syntax.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Instruments an assertion expression so that evaluating it records the value and
 * display column of every meaningful subexpression.
 *
 * <p>The expression is folded on construction. {@link #rewrite()} then walks the folded
 * tree bottom-up: each node's children are rewritten first and the node is then wrapped
 * in a capture call, left as it is, or (closures) skipped entirely. Because operands are
 * wrapped before the operation that consumes them, captures fire in the original
 * evaluation order.</p>
 *
 * <p>Columns are computed on the folded input tree and shifted by the start-column
 * offset, the distance from the start of the assertion invocation to the end of its
 * macro name, so they are relative to the invocation's line.</p>
 *
 * <p>The rewrite never fails on a well-formed tree. Unresolvable input degrades
 * diagnostic precision instead: an unfoldable sequence is captured as one value, a
 * missing anchor falls back to the node's own start.</p>
 */
public class CaptureRewriter {

    private static final Logger logger = LoggerFactory.getLogger(CaptureRewriter.class);

    private final Expr expression;
    private final int startColumn;
    private final DisplayColumnCalculator columns;
    private final ParentIndex parents;
    private final CaptureCallSynthesizer synthesizer;

    private int capturePoints;

    public CaptureRewriter(MacroExpansionExpr invocation, Expr expression) {
        this(invocation, expression, OperatorTable.standardOperators(), CaptureSink.DEFAULT);
    }

    public CaptureRewriter(MacroExpansionExpr invocation, Expr expression, OperatorTable operators, CaptureSink sink) {
        this(expression, startColumnOffset(invocation), operators, sink);
    }

    public CaptureRewriter(Expr expression, int startColumnOffset) {
        this(expression, startColumnOffset, OperatorTable.standardOperators(), CaptureSink.DEFAULT);
    }

    public CaptureRewriter(Expr expression, int startColumnOffset, OperatorTable operators, CaptureSink sink) {
        Objects.requireNonNull(expression, "expression");
        this.expression = new OperatorFolder(operators).foldAll(expression);
        this.startColumn = startColumnOffset;
        this.columns = new DisplayColumnCalculator(new SourceLocationConverter(this.expression));
        this.parents = ParentIndex.of(this.expression);
        this.synthesizer = new CaptureCallSynthesizer(sink);
    }

    /**
     * Rewriter for the first argument of an assertion invocation such as
     * {@code #assert(a == b)}.
     *
     * @throws IllegalArgumentException if the invocation has no arguments
     */
    public static CaptureRewriter forInvocation(MacroExpansionExpr invocation) {
        List<ListElement> arguments = invocation.arguments();
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("Invocation has no expression to instrument: "
                + invocation.toSource().strip());
        }
        return new CaptureRewriter(invocation, arguments.get(0).expression());
    }

    /**
     * Raw column distance between the start of the invocation and the end of its macro
     * name token.
     */
    public static int startColumnOffset(MacroExpansionExpr invocation) {
        SourceLocationConverter converter = new SourceLocationConverter(invocation);
        int start = converter.location(invocation).column();
        int end = converter.endLocation(invocation.macroName()).column();
        return end - start;
    }

    public Expr foldedExpression() {
        return expression;
    }

    public int startColumnOffset() {
        return startColumn;
    }

    public Expr rewrite() {
        capturePoints = 0;
        Expr rewritten = visit(expression);
        logger.debug("Instrumented {} capture points in `{}`", capturePoints, expression.toSource().strip());
        return rewritten;
    }

    private Expr visit(Expr node) {
        return switch (node.kind()) {
            case LITERAL, PREFIX_OPERATOR, FORCE_UNWRAP, TERNARY, TUPLE, ARRAY, DICTIONARY, KEY_PATH, MACRO_EXPANSION ->
                captureAt(node, node);
            case IDENTIFIER -> visitIdentifier((IdentifierExpr) node);
            case MEMBER_ACCESS -> visitMemberAccess((MemberAccessExpr) node);
            case SUBSCRIPT -> captureAt(node, ((SubscriptExpr) node).rightBracket());
            case CALL -> visitCall((CallExpr) node);
            case INFIX_OPERATOR -> captureAt(node, ((InfixOperatorExpr) node).operator());
            case SEQUENCE -> visitSequence((SequenceExpr) node);
            case OPTIONAL_CHAINING -> visitOptionalChaining((OptionalChainingExpr) node);
            case BINARY_OPERATOR, UNRESOLVED_TERNARY -> visitChildren(node);
            case CLOSURE -> node;
        };
    }

    private Expr visitIdentifier(IdentifierExpr node) {
        if (node.identifier().kind() == TokenKind.BINARY_OPERATOR || isCallee(node)) {
            return node;
        }
        int column = columns.columnOf(node);
        return wrap(synthesizer.selfReference(node), column);
    }

    private Expr visitMemberAccess(MemberAccessExpr node) {
        if (isCallee(node)) {
            // the enclosing call captures the whole access
            return visitChildren(node);
        }
        int column = columns.columnOf(node.name());
        CallExpr captured = wrap(visitChildren(node), column);
        Optional<OptionalChainingExpr> chain = TreeMatchers.findOnChain(node, OptionalChainingExpr.class);
        if (chain.isPresent()) {
            return synthesizer.reattachOptionalChain(captured, chain.get().questionMark());
        }
        return captured;
    }

    private Expr visitOptionalChaining(OptionalChainingExpr node) {
        Expr visited = visit(node.expression());
        if (visited != node.expression() && visited instanceof OptionalChainingExpr) {
            // the captured member access already carries the marker
            return visited;
        }
        return visited == node.expression() ? node : new OptionalChainingExpr(visited, node.questionMark());
    }

    private Expr visitCall(CallExpr node) {
        List<Syntax> calleeParts = node.callee().children();
        Syntax anchor = calleeParts.isEmpty() ? node : calleeParts.get(calleeParts.size() - 1);
        return captureAt(node, anchor);
    }

    private Expr visitSequence(SequenceExpr node) {
        Optional<BinaryOperatorExpr> operator = firstInfixOperator(node);
        if (operator.isEmpty()) {
            logger.debug("No operator to anchor unfolded sequence `{}`, using its start", node.toSource().strip());
        }
        return captureAt(node, operator.isPresent() ? operator.get() : node);
    }

    /**
     * First infix operator among the sequence's own elements, else the first one found by
     * descendant search. Unattached prefix and postfix operators share the element type
     * and are skipped.
     */
    private static Optional<BinaryOperatorExpr> firstInfixOperator(SequenceExpr node) {
        for (Expr element : node.elements()) {
            if (element instanceof BinaryOperatorExpr operator && isInfix(operator)) {
                return Optional.of(operator);
            }
        }
        return TreeMatchers.findDescendant(node, BinaryOperatorExpr.class, CaptureRewriter::isInfix);
    }

    private static boolean isInfix(BinaryOperatorExpr operator) {
        return operator.operator().kind() == TokenKind.BINARY_OPERATOR;
    }

    private Expr captureAt(Expr node, Syntax anchor) {
        int column = columns.columnOf(anchor);
        return wrap(visitChildren(node), column);
    }

    private Expr visitChildren(Expr node) {
        return node.mapChildren(this::visit);
    }

    private CallExpr wrap(Expr visited, int column) {
        capturePoints++;
        return synthesizer.wrap(visited, column + startColumn);
    }

    private boolean isCallee(Expr node) {
        return TreeMatchers.nearestAncestor(parents, node, CallExpr.class)
            .filter(call -> call.callee() == node)
            .isPresent();
    }
}
