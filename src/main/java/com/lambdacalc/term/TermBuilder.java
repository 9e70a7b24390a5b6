package com.lambdacalc.term;

import com.lambdacalc.term.Term.Abstraction;
import com.lambdacalc.term.Term.Application;
import com.lambdacalc.term.Term.TermInterface;
import com.lambdacalc.term.Term.Variable;

/**
 * Compact construction syntax for writing terms in Java code.
 *
 *   lam("x y", var("x"))          == (\x.(\y.x))
 *   app(var("f"), var("a"), var("b")) == [[f a] b]
 */
public final class TermBuilder {

    private TermBuilder() {}

    public static Variable var(String name) {
        return new Variable(name);
    }

    /** Curried abstraction over a whitespace separated parameter list, outermost first. */
    public static Abstraction lam(String parameters, TermInterface body) {
        String[] names = (parameters == null) ? new String[0] : parameters.trim().split("\\s+");
        if (names.length == 0 || names[0].isEmpty()) {
            throw new IllegalArgumentException("lam() needs at least one parameter name");
        }
        TermInterface out = body;
        for (int i = names.length - 1; i >= 0; i--) {
            out = new Abstraction(new Variable(names[i]), out);
        }
        return (Abstraction) out;
    }

    /** Left-associated application chain: app(f, a, b) == [[f a] b]. */
    public static TermInterface app(TermInterface function, TermInterface... arguments) {
        TermInterface out = function;
        for (TermInterface a : arguments) {
            out = new Application(out, a);
        }
        return out;
    }
}
