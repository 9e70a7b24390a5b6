package com.lambdacalc.library;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;

import java.util.List;

import com.lambdacalc.term.Term.TermInterface;

/** Lists as nested pairs (head, tail), terminated by NIL. */
public final class Lists {

    private Lists() {}

    public static void register(TermLibrary lib) {
        lib.register("NIL", Lists::nil);
        lib.register("ISNIL", Lists::isNil);
        lib.register("CONS", Lists::cons);
        lib.register("HEAD", Lists::head);
        lib.register("TAIL", Lists::tail);
        lib.register("INDEX", Lists::index);
    }

    public static TermInterface nil() {
        return lam("x", Booleans.bTrue());
    }

    public static TermInterface isNil() {
        return lam("p", app(var("p"), lam("x y", Booleans.bFalse())));
    }

    public static TermInterface cons() {
        return lam("h t", app(Pairs.pair(), var("h"), var("t")));
    }

    public static TermInterface head() {
        return Pairs.first();
    }

    public static TermInterface tail() {
        return Pairs.second();
    }

    /** INDEX list n: the n-th element, counting from zero. */
    public static TermInterface index() {
        return app(Combinators.y(), lam("f l n", app(
                Naturals.isZero(), var("n"),
                app(head(), var("l")),
                app(var("f"), app(tail(), var("l")), app(Naturals.pred(), var("n"))))));
    }

    /** CONS e0 (CONS e1 (... NIL)). */
    public static TermInterface of(List<TermInterface> elements) {
        TermInterface out = nil();
        for (int i = elements.size() - 1; i >= 0; i--) {
            out = app(cons(), elements.get(i), out);
        }
        return out;
    }
}
