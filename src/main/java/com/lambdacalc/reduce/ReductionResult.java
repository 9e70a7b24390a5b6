package com.lambdacalc.reduce;

import java.time.Duration;

import com.lambdacalc.term.Term.TermInterface;

public class ReductionResult {
    private final TermInterface start;
    private final TermInterface term;
    private final int steps;
    private final boolean converged;
    private final Duration elapsed;

    public ReductionResult(TermInterface start, TermInterface term, int steps, boolean converged, Duration elapsed) {
        this.start = start;
        this.term = term;
        this.steps = steps;
        this.converged = converged;
        this.elapsed = elapsed;
    }

    public TermInterface start() { return start; }

    /** The stable form when {@link #converged()}, otherwise the last term reached. */
    public TermInterface term() { return term; }

    /** Number of reduce calls made, including the final one that observed no change. */
    public int steps() { return steps; }

    public boolean converged() { return converged; }

    /** True when a stop condition cut the loop off before a fixpoint was seen. */
    public boolean stopped() { return !converged; }

    public Duration elapsed() { return elapsed; }

    public String render() { return term.render(); }

    @Override
    public String toString() {
        return (converged ? "converged" : "stopped") + " after " + steps + " step(s): " + term.render();
    }
}
