package com.lambdacalc.term;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import com.lambdacalc.term.Term.Abstraction;
import com.lambdacalc.term.Term.Application;
import com.lambdacalc.term.Term.TermInterface;
import com.lambdacalc.term.Term.TermVisitor;
import com.lambdacalc.term.Term.Variable;

/** Free and bound name analysis. Names only: there are no scoping identifiers. */
public final class FreeVariables {

    private FreeVariables() {}

    /** Free variable names, in order of first occurrence. */
    public static Set<String> of(TermInterface term) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        term.accept(new Collector(out));
        return Collections.unmodifiableSet(out);
    }

    public static boolean isClosed(TermInterface term) {
        return of(term).isEmpty();
    }

    public static boolean occursFree(String name, TermInterface term) {
        return of(term).contains(name);
    }

    /** Every name used in the term, bound or free. */
    public static Set<String> allNames(TermInterface term) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        term.accept(new TermVisitor<Void>() {
            @Override
            public Void visitVariable(Variable t) {
                out.add(t.name);
                return null;
            }

            @Override
            public Void visitAbstraction(Abstraction t) {
                out.add(t.parameter.name);
                return t.body.accept(this);
            }

            @Override
            public Void visitApplication(Application t) {
                t.function.accept(this);
                return t.argument.accept(this);
            }
        });
        return Collections.unmodifiableSet(out);
    }

    private static final class Collector implements TermVisitor<Void> {
        private final Set<String> out;
        private final Deque<String> bound = new ArrayDeque<>();

        Collector(Set<String> out) {
            this.out = out;
        }

        @Override
        public Void visitVariable(Variable t) {
            if (!bound.contains(t.name)) out.add(t.name);
            return null;
        }

        @Override
        public Void visitAbstraction(Abstraction t) {
            bound.push(t.parameter.name);
            try {
                return t.body.accept(this);
            } finally {
                bound.pop();
            }
        }

        @Override
        public Void visitApplication(Application t) {
            t.function.accept(this);
            return t.argument.accept(this);
        }
    }
}
