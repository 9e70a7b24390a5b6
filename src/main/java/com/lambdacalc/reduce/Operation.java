package com.lambdacalc.reduce;

/** The three core rewriting operations, as reported to a {@link ReductionTrace}. */
public enum Operation {
    SUBSTITUTE,
    APPLY,
    REDUCE
}
