package com.lambdacalc;

import java.time.Duration;
import java.util.Objects;

import com.lambdacalc.library.TermLibrary;
import com.lambdacalc.reduce.FixpointDriver;
import com.lambdacalc.reduce.Reducer;
import com.lambdacalc.reduce.ReductionResult;
import com.lambdacalc.reduce.ReductionTrace;
import com.lambdacalc.reduce.StopCondition;
import com.lambdacalc.reduce.SubstitutionMode;
import com.lambdacalc.term.Term.TermInterface;
import com.lambdacalc.term.TermBuilder;

/**
 * Engine facade: a term library plus the reducer configuration.
 *
 * - Substitution: CAPTURING (default) or HYGIENIC
 * - Bounds: step budget and wall-clock deadline, both off by default
 * - Trace: optional {@link ReductionTrace}, no-op by default
 *
 * Each evaluate call builds a fresh reducer and driver, so configuration
 * changes apply to the next call only.
 */
public class LambdaEngine {

    private final TermLibrary library;
    private SubstitutionMode substitutionMode = SubstitutionMode.CAPTURING;
    private ReductionTrace trace = ReductionTrace.NONE;
    private int stepBudget = 0;
    private Duration deadline = null;

    public LambdaEngine() {
        this(TermLibrary.standard());
    }

    public LambdaEngine(TermLibrary library) {
        this.library = Objects.requireNonNull(library, "library");
    }

    public TermLibrary library() { return library; }

    public void setSubstitutionMode(SubstitutionMode mode) {
        this.substitutionMode = (mode == null) ? SubstitutionMode.CAPTURING : mode;
    }

    public SubstitutionMode getSubstitutionMode() { return substitutionMode; }

    public void setTrace(ReductionTrace trace) {
        this.trace = (trace == null) ? ReductionTrace.NONE : trace;
    }

    /** Maximum number of reduce calls per evaluation; zero or less means unbounded. */
    public void setStepBudget(int budget) { this.stepBudget = budget; }

    public int getStepBudget() { return stepBudget; }

    /** Wall-clock limit per evaluation; null or non-positive means none. */
    public void setDeadline(Duration deadline) { this.deadline = deadline; }

    public Reducer reducer() {
        return new Reducer(substitutionMode, trace);
    }

    public ReductionResult evaluate(TermInterface term) {
        return evaluate(term, FixpointDriver.SILENT);
    }

    public ReductionResult evaluate(TermInterface term, FixpointDriver.Listener listener) {
        Objects.requireNonNull(term, "term");
        FixpointDriver driver = new FixpointDriver(reducer())
                .stopWhen(StopCondition.maxSteps(stepBudget).or(StopCondition.deadline(deadline)))
                .listener(listener);
        return driver.run(term);
    }

    /**
     * Builds the term named by {@code tokens}: the first token is the head, the
     * rest are applied to it left to right. Tokens are library names or
     * non-negative integers (Church numerals).
     */
    public TermInterface build(String... tokens) {
        if (tokens == null || tokens.length == 0) {
            throw new IllegalArgumentException("at least one term name required");
        }
        TermInterface head = library.resolve(tokens[0]);
        TermInterface[] args = new TermInterface[tokens.length - 1];
        for (int i = 1; i < tokens.length; i++) {
            args[i - 1] = library.resolve(tokens[i]);
        }
        return TermBuilder.app(head, args);
    }

    public ReductionResult evaluate(String... tokens) {
        return evaluate(build(tokens));
    }
}
