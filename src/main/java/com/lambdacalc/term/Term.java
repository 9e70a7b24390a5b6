package com.lambdacalc.term;

import java.util.Objects;

/**
 * The three term shapes of the untyped Lambda Calculus.
 *
 * Nodes are immutable: every operation over them builds new nodes and no
 * operation ever changes a node it was given. Unchanged subtrees may be reused
 * by the result, which is indistinguishable from a deep copy for immutable
 * values.
 *
 * Canonical rendering:
 *   Variable          -> name
 *   Abstraction(v, b) -> (\v.b)
 *   Application(f, a) -> [f a]
 */
public class Term {

    public enum Kind { VARIABLE, ABSTRACTION, APPLICATION }

    public interface TermInterface {
        <R> R accept(TermVisitor<R> visitor);

        Kind kind();

        /** Canonical textual form, used for display and for progress checks. */
        String render();
    }

    public interface TermVisitor<R> {
        R visitVariable(Variable term);
        R visitAbstraction(Abstraction term);
        R visitApplication(Application term);
    }

    // -------------------------
    // Nodes
    // -------------------------

    public static final class Variable implements TermInterface {
        public final String name;

        /** No validation: an empty name is accepted and only misbehaves when evaluated. */
        public Variable(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public Kind kind() { return Kind.VARIABLE; }

        @Override
        public String render() { return name; }

        public boolean sameName(Variable other) {
            return name.equals(other.name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && ((Variable) o).name.equals(name);
        }

        @Override
        public int hashCode() { return name.hashCode(); }

        @Override
        public String toString() { return render(); }
    }

    public static final class Abstraction implements TermInterface {
        public final Variable parameter;
        public final TermInterface body;

        private String rendered; // lazily cached, nodes never change

        public Abstraction(Variable parameter, TermInterface body) {
            this.parameter = Objects.requireNonNull(parameter, "parameter");
            this.body = Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitAbstraction(this);
        }

        @Override
        public Kind kind() { return Kind.ABSTRACTION; }

        @Override
        public String render() {
            String r = rendered;
            if (r == null) {
                StringBuilder sb = new StringBuilder();
                Term.renderInto(this, sb);
                r = sb.toString();
                rendered = r;
            }
            return r;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Abstraction)) return false;
            Abstraction other = (Abstraction) o;
            return parameter.equals(other.parameter) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return 31 * parameter.hashCode() + body.hashCode(); }

        @Override
        public String toString() { return render(); }
    }

    public static final class Application implements TermInterface {
        public final TermInterface function;
        public final TermInterface argument;

        private String rendered;

        public Application(TermInterface function, TermInterface argument) {
            this.function = Objects.requireNonNull(function, "function");
            this.argument = Objects.requireNonNull(argument, "argument");
        }

        @Override
        public <R> R accept(TermVisitor<R> visitor) {
            return visitor.visitApplication(this);
        }

        @Override
        public Kind kind() { return Kind.APPLICATION; }

        @Override
        public String render() {
            String r = rendered;
            if (r == null) {
                StringBuilder sb = new StringBuilder();
                Term.renderInto(this, sb);
                r = sb.toString();
                rendered = r;
            }
            return r;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Application)) return false;
            Application other = (Application) o;
            return function.equals(other.function) && argument.equals(other.argument);
        }

        @Override
        public int hashCode() { return 31 * function.hashCode() + argument.hashCode(); }

        @Override
        public String toString() { return render(); }
    }

    // -------------------------
    // Operations over any shape
    // -------------------------

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public static Abstraction abstraction(Variable parameter, TermInterface body) {
        return new Abstraction(parameter, body);
    }

    public static Application application(TermInterface function, TermInterface argument) {
        return new Application(function, argument);
    }

    public static String render(TermInterface term) {
        return term.render();
    }

    /** Textual equality: the progress oracle of the reducer. Not alpha-equivalence. */
    public static boolean sameRendering(TermInterface a, TermInterface b) {
        return a.render().equals(b.render());
    }

    /** Structural equality over names and shapes, independent of rendering. */
    public static boolean structurallyEqual(TermInterface a, TermInterface b) {
        return a.equals(b);
    }

    /** Number of nodes in the tree. */
    public static int size(TermInterface term) {
        return term.accept(new TermVisitor<Integer>() {
            @Override
            public Integer visitVariable(Variable t) { return 1; }

            @Override
            public Integer visitAbstraction(Abstraction t) { return 2 + t.body.accept(this); }

            @Override
            public Integer visitApplication(Application t) {
                return 1 + t.function.accept(this) + t.argument.accept(this);
            }
        });
    }

    private static void renderInto(TermInterface term, StringBuilder sb) {
        switch (term.kind()) {
            case VARIABLE:
                sb.append(((Variable) term).name);
                break;
            case ABSTRACTION: {
                Abstraction a = (Abstraction) term;
                // reuse already rendered children
                sb.append("(\\").append(a.parameter.name).append('.').append(a.body.render()).append(')');
                break;
            }
            case APPLICATION: {
                Application a = (Application) term;
                sb.append('[').append(a.function.render()).append(' ').append(a.argument.render()).append(']');
                break;
            }
        }
    }
}
