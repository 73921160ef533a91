package com.powerassert.operators;

import java.util.Objects;

/**
 * A named precedence level. Higher binding power binds tighter.
 */
public record PrecedenceGroup(
    String name,
    int bindingPower,
    Associativity associativity
) {
    public static final PrecedenceGroup ASSIGNMENT = new PrecedenceGroup("AssignmentPrecedence", 1, Associativity.RIGHT);
    public static final PrecedenceGroup TERNARY = new PrecedenceGroup("TernaryPrecedence", 2, Associativity.RIGHT);
    public static final PrecedenceGroup LOGICAL_DISJUNCTION = new PrecedenceGroup("LogicalDisjunctionPrecedence", 3, Associativity.LEFT);
    public static final PrecedenceGroup LOGICAL_CONJUNCTION = new PrecedenceGroup("LogicalConjunctionPrecedence", 4, Associativity.LEFT);
    public static final PrecedenceGroup COMPARISON = new PrecedenceGroup("ComparisonPrecedence", 5, Associativity.NONE);
    public static final PrecedenceGroup NIL_COALESCING = new PrecedenceGroup("NilCoalescingPrecedence", 6, Associativity.RIGHT);
    public static final PrecedenceGroup CASTING = new PrecedenceGroup("CastingPrecedence", 7, Associativity.LEFT);
    public static final PrecedenceGroup RANGE_FORMATION = new PrecedenceGroup("RangeFormationPrecedence", 8, Associativity.NONE);
    public static final PrecedenceGroup ADDITION = new PrecedenceGroup("AdditionPrecedence", 9, Associativity.LEFT);
    public static final PrecedenceGroup MULTIPLICATION = new PrecedenceGroup("MultiplicationPrecedence", 10, Associativity.LEFT);
    public static final PrecedenceGroup BITWISE_SHIFT = new PrecedenceGroup("BitwiseShiftPrecedence", 11, Associativity.NONE);

    public PrecedenceGroup {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(associativity, "associativity");
        if (bindingPower < 1) {
            throw new IllegalArgumentException("Binding power must be positive: " + bindingPower);
        }
    }
}
