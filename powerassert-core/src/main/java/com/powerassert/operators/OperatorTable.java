package com.powerassert.operators;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The operators precedence folding knows about: infix operators with their precedence
 * groups, prefix operator spellings, and the postfix {@code !} (force unwrap).
 *
 * <p>Tables are immutable. {@code with...} methods return extended copies.</p>
 */
public final class OperatorTable {

    private static final OperatorTable STANDARD = createStandardOperators();

    private final Map<String, PrecedenceGroup> infixOperators;
    private final Set<String> prefixOperators;
    private final Set<String> postfixOperators;

    private OperatorTable(Map<String, PrecedenceGroup> infixOperators,
                          Set<String> prefixOperators,
                          Set<String> postfixOperators) {
        this.infixOperators = Map.copyOf(infixOperators);
        this.prefixOperators = Set.copyOf(prefixOperators);
        this.postfixOperators = Set.copyOf(postfixOperators);
    }

    public static OperatorTable standardOperators() {
        return STANDARD;
    }

    public static OperatorTable empty() {
        return new OperatorTable(Map.of(), Set.of(), Set.of());
    }

    private static OperatorTable createStandardOperators() {
        Map<String, PrecedenceGroup> infix = new HashMap<>();
        for (String op : new String[] {"=", "*=", "/=", "%=", "+=", "-=", "<<=", ">>=", "&=", "|=", "^=", "&*=", "&+=", "&-=", "&<<=", "&>>="}) {
            infix.put(op, PrecedenceGroup.ASSIGNMENT);
        }
        infix.put("||", PrecedenceGroup.LOGICAL_DISJUNCTION);
        infix.put("&&", PrecedenceGroup.LOGICAL_CONJUNCTION);
        for (String op : new String[] {"<", "<=", ">", ">=", "==", "!=", "===", "!==", "~="}) {
            infix.put(op, PrecedenceGroup.COMPARISON);
        }
        infix.put("??", PrecedenceGroup.NIL_COALESCING);
        infix.put("...", PrecedenceGroup.RANGE_FORMATION);
        infix.put("..<", PrecedenceGroup.RANGE_FORMATION);
        for (String op : new String[] {"+", "-", "&+", "&-", "|", "^"}) {
            infix.put(op, PrecedenceGroup.ADDITION);
        }
        for (String op : new String[] {"*", "/", "%", "&*", "&"}) {
            infix.put(op, PrecedenceGroup.MULTIPLICATION);
        }
        for (String op : new String[] {"<<", ">>", "&<<", "&>>"}) {
            infix.put(op, PrecedenceGroup.BITWISE_SHIFT);
        }
        return new OperatorTable(infix, Set.of("!", "-", "+", "~"), Set.of("!"));
    }

    public Optional<PrecedenceGroup> infixGroup(String operator) {
        return Optional.ofNullable(infixOperators.get(operator));
    }

    public boolean isPrefixOperator(String operator) {
        return prefixOperators.contains(operator);
    }

    public boolean isPostfixOperator(String operator) {
        return postfixOperators.contains(operator);
    }

    public OperatorTable withInfixOperator(String operator, PrecedenceGroup group) {
        Map<String, PrecedenceGroup> infix = new HashMap<>(infixOperators);
        infix.put(operator, group);
        return new OperatorTable(infix, prefixOperators, postfixOperators);
    }

    public OperatorTable withPrefixOperator(String operator) {
        Set<String> prefix = new HashSet<>(prefixOperators);
        prefix.add(operator);
        return new OperatorTable(infixOperators, prefix, postfixOperators);
    }
}
