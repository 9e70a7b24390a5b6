package com.lambdacalc.library;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;

import com.lambdacalc.term.Term.TermInterface;

public final class Pairs {

    private Pairs() {}

    public static void register(TermLibrary lib) {
        lib.register("PAIR", Pairs::pair);
        lib.register("FIRST", Pairs::first);
        lib.register("SECOND", Pairs::second);
    }

    public static TermInterface pair() {
        return lam("x y f", app(var("f"), var("x"), var("y")));
    }

    public static TermInterface pair(TermInterface first, TermInterface second) {
        return app(pair(), first, second);
    }

    public static TermInterface first() {
        return lam("p", app(var("p"), Booleans.bTrue()));
    }

    public static TermInterface second() {
        return lam("p", app(var("p"), Booleans.bFalse()));
    }
}
