package com.lambdacalc.reduce;

import java.util.Arrays;
import java.util.Collections;

import com.lambdacalc.term.Term;
import com.lambdacalc.term.Term.Abstraction;
import com.lambdacalc.term.Term.Application;
import com.lambdacalc.term.Term.Kind;
import com.lambdacalc.term.Term.TermInterface;
import com.lambdacalc.term.Term.TermVisitor;
import com.lambdacalc.term.Term.Variable;

/**
 * The rewriting core: substitute, apply (one beta step) and reduce (one global
 * step). All three are total and pure; the only side channel is the optional
 * {@link ReductionTrace}.
 *
 * Reduction goes inside abstraction bodies, so repeated reduction reaches full
 * beta-normal forms, not just weak head normal forms.
 */
public final class Reducer {

    private final SubstitutionMode mode;
    private final ReductionTrace trace;
    private final ReduceVisitor reduceVisitor = new ReduceVisitor();

    public Reducer() {
        this(SubstitutionMode.CAPTURING, ReductionTrace.NONE);
    }

    public Reducer(SubstitutionMode mode, ReductionTrace trace) {
        this.mode = (mode == null) ? SubstitutionMode.CAPTURING : mode;
        this.trace = (trace == null) ? ReductionTrace.NONE : trace;
    }

    public SubstitutionMode mode() { return mode; }

    public ReductionTrace trace() { return trace; }

    /** term[v := replacement]. Reported once per call; the structural recursion is internal. */
    public TermInterface substitute(TermInterface term, Variable v, TermInterface replacement) {
        TermInterface result = Substitution.substitute(term, v, replacement, mode);
        trace.step(Operation.SUBSTITUTE, Arrays.asList(term, v, replacement), result);
        return result;
    }

    /**
     * Uses {@code head} as a function applied to {@code argument}.
     *
     *   Variable head:    [head argument], where an Application argument is first reduced one step
     *   Abstraction head: the beta step; an argument rendering as the parameter's own name
     *                     returns the body untouched
     *   Application head: reduce the head; if that changes nothing the pair is returned
     *                     as is, otherwise the reduced head is applied again. A head that
     *                     never settles ([[Y I] a]) recurses until the stack runs out.
     */
    public TermInterface apply(TermInterface head, TermInterface argument) {
        TermInterface result;
        switch (head.kind()) {
            case VARIABLE: {
                TermInterface arg = (argument.kind() == Kind.APPLICATION) ? reduce(argument) : argument;
                result = new Application(head, arg);
                break;
            }
            case ABSTRACTION: {
                Abstraction fn = (Abstraction) head;
                if (argument.render().equals(fn.parameter.name)) {
                    result = fn.body;
                } else {
                    result = substitute(fn.body, fn.parameter, argument);
                }
                break;
            }
            case APPLICATION: {
                TermInterface reduced = reduce(head);
                if (Term.sameRendering(reduced, head)) {
                    result = new Application(head, argument);
                } else {
                    result = apply(reduced, argument);
                }
                break;
            }
            default:
                throw new IllegalStateException("Unknown term kind: " + head.kind());
        }
        trace.step(Operation.APPLY, Arrays.asList(head, argument), result);
        return result;
    }

    /** One rewrite step, directed by the shape of {@code term}. Variables are fixed points. */
    public TermInterface reduce(TermInterface term) {
        TermInterface result = term.accept(reduceVisitor);
        trace.step(Operation.REDUCE, Collections.singletonList(term), result);
        return result;
    }

    private final class ReduceVisitor implements TermVisitor<TermInterface> {

        @Override
        public TermInterface visitVariable(Variable t) {
            return t;
        }

        @Override
        public TermInterface visitAbstraction(Abstraction t) {
            return new Abstraction(t.parameter, reduce(t.body));
        }

        @Override
        public TermInterface visitApplication(Application t) {
            // a free variable in function position: only the argument can progress
            if (t.function.kind() == Kind.VARIABLE) {
                return new Application(t.function, reduce(t.argument));
            }
            return apply(t.function, t.argument);
        }
    }
}
