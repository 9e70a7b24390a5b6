package com.lambdacalc;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.lambdacalc.debug.Debug;
import com.lambdacalc.debug.DebugLevel;
import com.lambdacalc.debug.DebugSink;
import com.lambdacalc.protocol.util.ReductionReport;
import com.lambdacalc.reduce.ReductionResult;
import com.lambdacalc.reduce.ReductionTraceOut;
import com.lambdacalc.reduce.SubstitutionMode;
import com.lambdacalc.term.Term.TermInterface;

/**
 * Evaluates a library term to its stable form.
 *
 * Usage:
 *   LambdaCli [--verbosity=quiet|summary|verbose] [--budget=N] [--timeoutMs=N]
 *             [--hygienic] [--trace] [--debug] [--json] [--list] [HEAD [ARG...]]
 *
 * Example:
 *   LambdaCli --verbosity=verbose PLUS 2 2
 *
 * Without a term, evaluates FACT 3.
 */
public final class LambdaCli {

    private static final String[] DEFAULT_TERM = { "FACT", "3" };

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Exit codes: 0 ok, 1 evaluation error, 2 usage error. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        final Map<String, String> flags = new HashMap<>();
        final List<String> tokens = new ArrayList<>();
        parseArgs(args, flags, tokens);

        final LambdaEngine engine = new LambdaEngine();
        final Verbosity verbosity;
        try {
            verbosity = Verbosity.parse(flags.get("verbosity"));
            engine.setStepBudget(intFlag(flags, "budget"));
            int timeoutMs = intFlag(flags, "timeoutMs");
            if (timeoutMs > 0) engine.setDeadline(Duration.ofMillis(timeoutMs));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            usage(err);
            return 2;
        }

        if (flags.containsKey("list")) {
            for (String name : engine.library().names()) out.println(name);
            return 0;
        }

        if (flags.containsKey("hygienic")) engine.setSubstitutionMode(SubstitutionMode.HYGIENIC);
        final DebugSink previousSink = Debug.get().getSink();
        try {
            return evaluate(engine, flags, tokens, verbosity, out, err);
        } finally {
            Debug.get().setSink(previousSink);
        }
    }

    private static int evaluate(LambdaEngine engine, Map<String, String> flags, List<String> tokens,
                                Verbosity verbosity, PrintStream out, PrintStream err) {
        if (flags.containsKey("trace")) {
            Debug.get().setSink(Debug.printing(err, DebugLevel.TRACE));
            engine.setTrace(new ReductionTraceOut());
        } else if (flags.containsKey("debug")) {
            Debug.get().setSink(Debug.printing(err, DebugLevel.DEBUG));
        }

        final TermInterface main;
        try {
            main = engine.build(tokens.isEmpty() ? DEFAULT_TERM : tokens.toArray(new String[0]));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }

        try {
            if (flags.containsKey("json")) {
                ReductionResult result = engine.evaluate(main);
                out.println(ReductionReport.toPrettyString(result));
            } else {
                ReductionPrinter printer = new ReductionPrinter(out, verbosity);
                printer.begin(main);
                ReductionResult result = engine.evaluate(main, printer);
                printer.finish(result);
            }
            return 0;
        } catch (StackOverflowError e) {
            err.println("Evaluation error: reduction recursed too deeply within a single step"
                    + " (the step budget and deadline only apply between steps)");
            return 1;
        } catch (RuntimeException e) {
            err.println("Evaluation error:");
            e.printStackTrace(err);
            return 1;
        }
    }

    private static void parseArgs(String[] args, Map<String, String> flags, List<String> tokens) {
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                flags.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else {
                tokens.add(a);
            }
        }
    }

    private static int intFlag(Map<String, String> flags, String name) {
        String v = flags.get(name);
        if (v == null) return 0;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects an integer, got: " + v, e);
        }
    }

    private static void usage(PrintStream err) {
        err.println("Usage: LambdaCli [--verbosity=quiet|summary|verbose] [--budget=N] [--timeoutMs=N]"
                + " [--hygienic] [--trace] [--debug] [--json] [--list] [HEAD [ARG...]]");
    }

    private LambdaCli() {}
}
