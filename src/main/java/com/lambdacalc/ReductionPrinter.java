package com.lambdacalc;

import java.io.PrintStream;

import com.lambdacalc.reduce.FixpointDriver;
import com.lambdacalc.reduce.ReductionResult;
import com.lambdacalc.term.Term.TermInterface;

/**
 * Prints a reduction at a given {@link Verbosity}:
 *
 *   MAIN := [start]
 *   = [intermediate]
 *   ...
 *   = [result]
 */
public final class ReductionPrinter implements FixpointDriver.Listener {

    private final PrintStream out;
    private final Verbosity verbosity;
    private final StringBuilder summary = new StringBuilder();

    public ReductionPrinter(PrintStream out, Verbosity verbosity) {
        this.out = out;
        this.verbosity = (verbosity == null) ? Verbosity.QUIET : verbosity;
    }

    public void begin(TermInterface main) {
        String line = "MAIN := " + main.render();
        if (verbosity != Verbosity.SUMMARY) {
            out.println();
            out.println(line);
        }
        if (verbosity != Verbosity.QUIET) {
            summary.append('\n').append(line).append('\n');
        }
    }

    @Override
    public void onStep(int step, TermInterface term) {
        if (verbosity == Verbosity.QUIET) return;
        String line = "= " + term.render();
        if (verbosity == Verbosity.VERBOSE) {
            out.println();
            out.println(line);
        }
        summary.append('\n').append(line).append('\n');
    }

    public void finish(ReductionResult result) {
        if (verbosity != Verbosity.SUMMARY) {
            out.println();
            out.println("= " + result.render());
        }
        if (result.stopped()) {
            out.println();
            out.println("(stopped after " + result.steps() + " step(s) without reaching a fixpoint)");
        }
        if (verbosity != Verbosity.QUIET) {
            if (verbosity == Verbosity.VERBOSE) {
                out.println("\n\n\nSummary:");
            }
            out.print(summary);
            out.flush();
        }
    }
}
