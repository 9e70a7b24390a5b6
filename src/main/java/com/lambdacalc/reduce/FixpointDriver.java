package com.lambdacalc.reduce;

import java.time.Duration;
import java.util.Objects;

import com.lambdacalc.debug.Debug;
import com.lambdacalc.term.Term;
import com.lambdacalc.term.Term.TermInterface;

/**
 * Drives a term to a stable form: reduce, compare renderings, repeat.
 *
 * The loop itself has no bound. A term without a normal form keeps it
 * running until the {@link StopCondition} says otherwise.
 */
public final class FixpointDriver {

    private static final String TAG = "lambda.driver";

    /** Told of every new intermediate term, in order. */
    public interface Listener {
        void onStep(int step, TermInterface term);
    }

    public static final Listener SILENT = (step, term) -> {
        // intentionally empty
    };

    private final Reducer reducer;
    private StopCondition stop = StopCondition.never();
    private Listener listener = SILENT;

    public FixpointDriver(Reducer reducer) {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
    }

    public FixpointDriver() {
        this(new Reducer());
    }

    public FixpointDriver stopWhen(StopCondition stop) {
        this.stop = (stop == null) ? StopCondition.never() : stop;
        return this;
    }

    public FixpointDriver listener(Listener listener) {
        this.listener = (listener == null) ? SILENT : listener;
        return this;
    }

    public Reducer reducer() { return reducer; }

    public ReductionResult run(TermInterface start) {
        return run(start, stop);
    }

    /** Runs with an extra step budget on top of the configured stop condition. */
    public ReductionResult run(TermInterface start, int stepBudget) {
        return run(start, stop.or(StopCondition.maxSteps(stepBudget)));
    }

    private ReductionResult run(TermInterface start, StopCondition until) {
        Objects.requireNonNull(start, "start");
        final boolean logging = Debug.get().isEnabled();
        if (logging) Debug.get().d(TAG, "reducing " + start.render());

        long t0 = System.nanoTime();
        TermInterface current = start;
        int steps = 0;

        while (true) {
            if (until.shouldStop(steps, current)) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
                Debug.get().w(TAG, "stopped without a fixpoint after " + steps + " step(s)");
                return new ReductionResult(start, current, steps, false, elapsed);
            }

            TermInterface next = reducer.reduce(current);
            steps++;

            if (Term.sameRendering(next, current)) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
                if (logging) Debug.get().d(TAG, "fixpoint after " + steps + " step(s): " + current.render());
                return new ReductionResult(start, current, steps, true, elapsed);
            }

            current = next;
            listener.onStep(steps, current);
        }
    }
}
