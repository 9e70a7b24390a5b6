package com.lambdacalc.reduce;

import java.util.List;

import com.lambdacalc.term.Term.TermInterface;

/**
 * Receives one event per substitute/apply/reduce call, after the call returns.
 *
 * inputs for SUBSTITUTE are (term, target variable, replacement), for APPLY
 * (head, argument) and for REDUCE (term).
 */
public interface ReductionTrace {

    ReductionTrace NONE = (op, inputs, result) -> {
        // intentionally empty
    };

    void step(Operation op, List<TermInterface> inputs, TermInterface result);
}
