package com.lambdacalc.library;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;

import com.lambdacalc.term.Term.TermInterface;

/** Church numerals: n is (\f.(\x.[f ... [f x]])) with n applications of f. */
public final class Naturals {

    private Naturals() {}

    public static void register(TermLibrary lib) {
        lib.register("ZERO", Naturals::zero);
        lib.register("ONE", Naturals::one);
        lib.register("SUCC", Naturals::succ);
        lib.register("PLUS", Naturals::plus);
        lib.register("MULT", Naturals::mult);
        lib.register("POW", Naturals::pow);
        lib.register("PRED", Naturals::pred);
        lib.register("SUB", Naturals::sub);
        lib.register("ISZERO", Naturals::isZero);
        lib.register("LEQ", Naturals::leq);
    }

    /** Church numeral for {@code n}; zero or less gives ZERO. */
    public static TermInterface nat(int n) {
        if (n <= 0) return zero();
        TermInterface numeral = app(var("f"), var("x"));
        for (int i = 1; i < n; i++) {
            numeral = app(var("f"), numeral);
        }
        return lam("f x", numeral);
    }

    public static TermInterface zero() {
        return lam("f x", var("x"));
    }

    public static TermInterface one() {
        return lam("f x", app(var("f"), var("x")));
    }

    public static TermInterface succ() {
        return lam("n f x", app(var("f"), app(var("n"), var("f"), var("x"))));
    }

    public static TermInterface plus() {
        return lam("m n", app(var("m"), succ(), var("n")));
    }

    public static TermInterface mult() {
        return lam("m n", app(var("m"), app(plus(), var("n")), zero()));
    }

    public static TermInterface pow() {
        return lam("m n", app(var("n"), app(mult(), var("m")), one()));
    }

    public static TermInterface pred() {
        return lam("n f x", app(
                var("n"),
                lam("g h", app(var("h"), app(var("g"), var("f")))),
                lam("u", var("x")),
                lam("u", var("u"))));
    }

    /** m - n, floored at zero. */
    public static TermInterface sub() {
        return lam("m n", app(var("n"), pred(), var("m")));
    }

    public static TermInterface isZero() {
        return lam("n", app(var("n"), lam("x", Booleans.bFalse()), Booleans.bTrue()));
    }

    public static TermInterface leq() {
        return lam("m n", app(isZero(), app(sub(), var("m"), var("n"))));
    }
}
