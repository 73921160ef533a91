package com.powerassert;

import com.powerassert.syntax.ArrayExpr;
import com.powerassert.syntax.CallExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.ForceUnwrapExpr;
import com.powerassert.syntax.IdentifierExpr;
import com.powerassert.syntax.InfixOperatorExpr;
import com.powerassert.syntax.ListElement;
import com.powerassert.syntax.LiteralExpr;
import com.powerassert.syntax.MemberAccessExpr;
import com.powerassert.syntax.OptionalChainingExpr;
import com.powerassert.syntax.PrefixOperatorExpr;
import com.powerassert.syntax.SubscriptExpr;
import com.powerassert.syntax.TernaryExpr;
import com.powerassert.syntax.Token;
import com.powerassert.syntax.TupleExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tiny interpreter for folded expression trees, used to run instrumented output.
 *
 * <p>Integers are longs, strings are strings, nil is null, member access reads from a
 * {@code Map}, and a callable is a {@code Function<List<Object>, Object>}. Calls to
 * {@code $0.capture(value, column: n)} record the value and column and return the value.</p>
 */
final class ExpressionEvaluator {

    record Capture(Object value, int column) {
    }

    private static final class ShortCircuit extends RuntimeException {
        ShortCircuit() {
            super(null, null, false, false);
        }
    }

    private final Map<String, Object> variables = new HashMap<>();
    private final List<Capture> captures = new ArrayList<>();

    ExpressionEvaluator define(String name, Object value) {
        variables.put(name, value);
        return this;
    }

    List<Capture> captures() {
        return captures;
    }

    List<Object> capturedValues() {
        List<Object> values = new ArrayList<>();
        for (Capture capture : captures) {
            values.add(capture.value());
        }
        return values;
    }

    List<Integer> capturedColumns() {
        List<Integer> columns = new ArrayList<>();
        for (Capture capture : captures) {
            columns.add(capture.column());
        }
        return columns;
    }

    /**
     * Evaluates a complete expression; an optional chain that hits nil yields nil.
     */
    Object evaluate(Expr expression) {
        try {
            return evaluateChain(expression);
        } catch (ShortCircuit e) {
            return null;
        }
    }

    private Object evaluateChain(Expr expression) {
        switch (expression.kind()) {
            case LITERAL:
                return literal(((LiteralExpr) expression).token());
            case IDENTIFIER:
                return lookup(((IdentifierExpr) expression).identifier().text());
            case MEMBER_ACCESS:
                return member((MemberAccessExpr) expression);
            case SUBSCRIPT: {
                SubscriptExpr subscript = (SubscriptExpr) expression;
                List<?> list = (List<?>) evaluateChain(subscript.callee());
                long index = (Long) evaluate(subscript.arguments().get(0).expression());
                return list.get((int) index);
            }
            case CALL:
                return call((CallExpr) expression);
            case PREFIX_OPERATOR:
                return prefix((PrefixOperatorExpr) expression);
            case FORCE_UNWRAP: {
                Object value = evaluateChain(((ForceUnwrapExpr) expression).expression());
                if (value == null) {
                    throw new IllegalStateException("Unexpectedly found nil while unwrapping");
                }
                return value;
            }
            case OPTIONAL_CHAINING: {
                Object value = evaluateChain(((OptionalChainingExpr) expression).expression());
                if (value == null) {
                    throw new ShortCircuit();
                }
                return value;
            }
            case INFIX_OPERATOR:
                return infix((InfixOperatorExpr) expression);
            case TERNARY: {
                TernaryExpr ternary = (TernaryExpr) expression;
                return (Boolean) evaluate(ternary.condition())
                    ? evaluate(ternary.firstChoice())
                    : evaluate(ternary.secondChoice());
            }
            case TUPLE: {
                List<ListElement> elements = ((TupleExpr) expression).elements();
                if (elements.size() == 1) {
                    return evaluate(elements.get(0).expression());
                }
                return evaluateAll(elements);
            }
            case ARRAY:
                return evaluateAll(((ArrayExpr) expression).elements());
            default:
                throw new UnsupportedOperationException("Cannot evaluate " + expression.kind());
        }
    }

    private Object literal(Token token) {
        switch (token.kind()) {
            case INTEGER_LITERAL:
                return Long.parseLong(token.text());
            case STRING_LITERAL:
                return token.text().substring(1, token.text().length() - 1);
            case KEYWORD:
                if (token.text().equals("nil")) {
                    return null;
                }
                return Boolean.parseBoolean(token.text());
            default:
                throw new UnsupportedOperationException("Cannot evaluate literal " + token.text());
        }
    }

    private Object lookup(String name) {
        if (!variables.containsKey(name)) {
            throw new IllegalStateException("Undefined variable " + name);
        }
        return variables.get(name);
    }

    private Object member(MemberAccessExpr access) {
        Object base = evaluateChain(access.base());
        if (access.name().text().equals("self")) {
            return base;
        }
        return ((Map<?, ?>) base).get(access.name().text());
    }

    @SuppressWarnings("unchecked")
    private Object call(CallExpr call) {
        if (call.callee() instanceof MemberAccessExpr access
                && access.base() instanceof IdentifierExpr receiver
                && receiver.identifier().text().equals("$0")) {
            Object value = evaluate(call.arguments().get(0).expression());
            int column = ((Long) evaluate(call.arguments().get(1).expression())).intValue();
            captures.add(new Capture(value, column));
            return value;
        }
        Object function;
        if (call.callee() instanceof MemberAccessExpr access) {
            Map<?, ?> receiver = (Map<?, ?>) evaluateChain(access.base());
            function = receiver.get(access.name().text());
        } else {
            function = evaluateChain(call.callee());
        }
        return ((Function<List<Object>, Object>) function).apply(evaluateAll(call.arguments()));
    }

    private Object prefix(PrefixOperatorExpr prefix) {
        Object operand = evaluate(prefix.operand());
        switch (prefix.operator().text()) {
            case "!":
                return !(Boolean) operand;
            case "-":
                return -(Long) operand;
            default:
                throw new UnsupportedOperationException("Cannot evaluate prefix " + prefix.operator().text());
        }
    }

    private Object infix(InfixOperatorExpr infix) {
        String operator = infix.operator().operator().text();
        Object left = evaluate(infix.leftOperand());
        switch (operator) {
            case "&&":
                return (Boolean) left && (Boolean) evaluate(infix.rightOperand());
            case "||":
                return (Boolean) left || (Boolean) evaluate(infix.rightOperand());
            case "??":
                return left != null ? left : evaluate(infix.rightOperand());
            default:
                break;
        }
        Object right = evaluate(infix.rightOperand());
        switch (operator) {
            case "==":
                return Objects.equals(left, right);
            case "!=":
                return !Objects.equals(left, right);
            case "+":
                if (left instanceof String) {
                    return (String) left + right;
                }
                return (Long) left + (Long) right;
            case "-":
                return (Long) left - (Long) right;
            case "*":
                return (Long) left * (Long) right;
            case "/":
                return (Long) left / (Long) right;
            case "<":
                return (Long) left < (Long) right;
            case ">":
                return (Long) left > (Long) right;
            case "<=":
                return (Long) left <= (Long) right;
            case ">=":
                return (Long) left >= (Long) right;
            default:
                throw new UnsupportedOperationException("Cannot evaluate operator " + operator);
        }
    }

    private List<Object> evaluateAll(List<ListElement> elements) {
        List<Object> values = new ArrayList<>(elements.size());
        for (ListElement element : elements) {
            values.add(evaluate(element.expression()));
        }
        return values;
    }
}
