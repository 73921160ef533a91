package com.powerassert.operators;

public enum Associativity {
    LEFT,
    RIGHT,
    // chaining two operators of the group without parentheses is an error
    NONE
}
