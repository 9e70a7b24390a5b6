package com.lambdacalc.term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import com.lambdacalc.term.Term.Abstraction;
import com.lambdacalc.term.Term.Application;
import com.lambdacalc.term.Term.TermInterface;
import com.lambdacalc.term.Term.TermVisitor;
import com.lambdacalc.term.Term.Variable;

/**
 * Alpha-equivalence through a de Bruijn rendering.
 *
 * Bound occurrences print as the distance to their binder (0 = innermost),
 * binders print without a name and free variables keep their names:
 *
 *   (\x.(\y.x))  -> (\.(\.1))
 *   (\y.[y z])   -> (\.[0 $z])
 *
 * Free names are prefixed with '$' so that a free variable named "0" can
 * never collide with an index.
 */
public final class AlphaEquivalence {

    private AlphaEquivalence() {}

    public static String toDeBruijn(TermInterface term) {
        StringBuilder sb = new StringBuilder();
        term.accept(new Printer(sb));
        return sb.toString();
    }

    public static boolean equivalent(TermInterface a, TermInterface b) {
        return toDeBruijn(a).equals(toDeBruijn(b));
    }

    private static final class Printer implements TermVisitor<Void> {
        private final StringBuilder sb;
        private final Deque<String> binders = new ArrayDeque<>(); // innermost first

        Printer(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitVariable(Variable t) {
            int index = 0;
            Iterator<String> it = binders.iterator();
            while (it.hasNext()) {
                if (it.next().equals(t.name)) {
                    sb.append(index);
                    return null;
                }
                index++;
            }
            sb.append('$').append(t.name);
            return null;
        }

        @Override
        public Void visitAbstraction(Abstraction t) {
            sb.append("(\\.");
            binders.push(t.parameter.name);
            try {
                t.body.accept(this);
            } finally {
                binders.pop();
            }
            sb.append(')');
            return null;
        }

        @Override
        public Void visitApplication(Application t) {
            sb.append('[');
            t.function.accept(this);
            sb.append(' ');
            t.argument.accept(this);
            sb.append(']');
            return null;
        }
    }
}
