package com.lambdacalc.library;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;

import com.lambdacalc.term.Term.TermInterface;

/**
 * The classic combinators.
 *
 * S K K reduces to I, and S and K alone are Turing complete. IOTA is complete
 * by itself: IOTA IOTA = I, IOTA (IOTA (IOTA IOTA)) = K.
 */
public final class Combinators {

    private Combinators() {}

    public static void register(TermLibrary lib) {
        lib.register("I", Combinators::i);
        lib.register("K", Combinators::k);
        lib.register("S", Combinators::s);
        lib.register("B", Combinators::b);
        lib.register("C", Combinators::c);
        lib.register("W", Combinators::w);
        lib.register("U", Combinators::u);
        lib.register("Y", Combinators::y);
        lib.register("IOTA", Combinators::iota);
        lib.register("OMEGA", Combinators::omega);
    }

    public static TermInterface i() {
        return lam("x", var("x"));
    }

    public static TermInterface k() {
        return lam("x y", var("x"));
    }

    public static TermInterface s() {
        return lam("x y z", app(var("x"), var("z"), app(var("y"), var("z"))));
    }

    public static TermInterface b() {
        return lam("x y z", app(var("x"), app(var("y"), var("z"))));
    }

    public static TermInterface c() {
        return lam("x y z", app(var("x"), var("z"), var("y")));
    }

    public static TermInterface w() {
        return lam("x y", app(var("x"), var("y"), var("y")));
    }

    /** Self-application. */
    public static TermInterface u() {
        return lam("x", app(var("x"), var("x")));
    }

    public static TermInterface y() {
        TermInterface half = lam("x", app(var("g"), app(var("x"), var("x"))));
        return lam("g", app(half, lam("x", app(var("g"), app(var("x"), var("x"))))));
    }

    public static TermInterface iota() {
        return lam("f", app(var("f"), s(), k()));
    }

    /** U U: has no normal form, but one reduce step reproduces its own rendering. */
    public static TermInterface omega() {
        return app(u(), u());
    }
}
