package com.lambdacalc.library;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;

import com.lambdacalc.term.Term.TermInterface;

/** Recursive functions tied through the Y combinator. */
public final class Algorithms {

    private Algorithms() {}

    public static void register(TermLibrary lib) {
        lib.register("FACT", Algorithms::factorial);
        lib.register("FIBO", Algorithms::fibonacci);
    }

    public static TermInterface factorial() {
        return app(Combinators.y(), lam("f n", app(
                Naturals.isZero(), var("n"),
                Naturals.one(),
                app(Naturals.mult(), var("n"), app(var("f"), app(Naturals.pred(), var("n")))))));
    }

    public static TermInterface fibonacci() {
        TermInterface n1 = app(Naturals.pred(), var("n"));
        TermInterface n2 = app(Naturals.pred(), app(Naturals.pred(), var("n")));
        return app(Combinators.y(), lam("f n", app(
                Naturals.isZero(), var("n"),
                Naturals.zero(),
                app(Naturals.isZero(), n1,
                        Naturals.one(),
                        app(Naturals.plus(), app(var("f"), n1), app(var("f"), n2))))));
    }
}
