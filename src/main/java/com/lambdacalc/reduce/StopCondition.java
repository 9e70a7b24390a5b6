package com.lambdacalc.reduce;

import java.time.Duration;

import com.lambdacalc.term.Term.TermInterface;

/**
 * External bound on the fixpoint loop. Checked before every reduce call with
 * the number of reduce calls made so far and the current term.
 */
@FunctionalInterface
public interface StopCondition {

    boolean shouldStop(int step, TermInterface current);

    static StopCondition never() {
        return (step, current) -> false;
    }

    /** Stops once {@code budget} reduce calls have been made. A budget of zero or less is unbounded. */
    static StopCondition maxSteps(int budget) {
        if (budget <= 0) return never();
        return (step, current) -> step >= budget;
    }

    /** Wall-clock deadline measured from the moment this condition is created. */
    static StopCondition deadline(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return never();
        final long until = System.nanoTime() + timeout.toNanos();
        return (step, current) -> System.nanoTime() - until >= 0;
    }

    default StopCondition or(StopCondition other) {
        if (other == null) return this;
        return (step, current) -> shouldStop(step, current) || other.shouldStop(step, current);
    }
}
