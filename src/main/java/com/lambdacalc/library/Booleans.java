package com.lambdacalc.library;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;

import com.lambdacalc.term.Term.TermInterface;

/** Church booleans: TRUE selects its first argument, FALSE its second. */
public final class Booleans {

    private Booleans() {}

    public static void register(TermLibrary lib) {
        lib.register("TRUE", Booleans::bTrue);
        lib.register("FALSE", Booleans::bFalse);
        lib.register("NOT", Booleans::not);
        lib.register("AND", Booleans::and);
        lib.register("OR", Booleans::or);
        lib.register("XOR", Booleans::xor);
    }

    public static TermInterface bTrue() {
        return lam("x y", var("x"));
    }

    public static TermInterface bFalse() {
        return lam("x y", var("y"));
    }

    public static TermInterface bool(boolean b) {
        return b ? bTrue() : bFalse();
    }

    public static TermInterface not() {
        return lam("p", app(var("p"), bFalse(), bTrue()));
    }

    public static TermInterface and() {
        return lam("p q", app(var("p"), var("q"), var("p")));
    }

    public static TermInterface or() {
        return lam("p q", app(var("p"), var("p"), var("q")));
    }

    public static TermInterface xor() {
        return lam("p q", app(var("p"), app(not(), var("q")), var("q")));
    }
}
