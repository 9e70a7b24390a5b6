package com.lambdacalc.library;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;

import com.lambdacalc.term.Term.TermInterface;

/**
 * Signed integers as a pair of naturals (positive part, negative part):
 * the value is first - second.
 */
public final class Integers {

    private Integers() {}

    public static void register(TermLibrary lib) {
        lib.register("CONVERT", Integers::convert);
        lib.register("NEG", Integers::neg);
        lib.register("IPLUS", Integers::plus);
        lib.register("ISUB", Integers::sub);
        lib.register("IMULT", Integers::mult);
    }

    /** Signed value of {@code n}, with the negative part ZERO or the positive part ZERO. */
    public static TermInterface integer(int n) {
        return (n >= 0)
                ? Pairs.pair(Naturals.nat(n), Naturals.zero())
                : Pairs.pair(Naturals.zero(), Naturals.nat(-n));
    }

    /** Natural to signed. */
    public static TermInterface convert() {
        return lam("a", app(Pairs.pair(), var("a"), Naturals.zero()));
    }

    public static TermInterface neg() {
        return lam("a", app(Pairs.pair(), second(var("a")), first(var("a"))));
    }

    public static TermInterface plus() {
        return lam("a b", app(Pairs.pair(),
                app(Naturals.plus(), first(var("a")), first(var("b"))),
                app(Naturals.plus(), second(var("a")), second(var("b")))));
    }

    public static TermInterface sub() {
        return lam("a b", app(plus(), var("a"), app(neg(), var("b"))));
    }

    public static TermInterface mult() {
        return lam("a b", app(Pairs.pair(),
                app(Naturals.plus(),
                        app(Naturals.mult(), first(var("a")), first(var("b"))),
                        app(Naturals.mult(), second(var("a")), second(var("b")))),
                app(Naturals.plus(),
                        app(Naturals.mult(), first(var("a")), second(var("b"))),
                        app(Naturals.mult(), second(var("a")), first(var("b"))))));
    }

    private static TermInterface first(TermInterface t) {
        return app(Pairs.first(), t);
    }

    private static TermInterface second(TermInterface t) {
        return app(Pairs.second(), t);
    }
}
