package com.lambdacalc.reduce;

import java.util.HashSet;
import java.util.Set;

import com.lambdacalc.term.FreeVariables;
import com.lambdacalc.term.Term.Abstraction;
import com.lambdacalc.term.Term.Application;
import com.lambdacalc.term.Term.TermInterface;
import com.lambdacalc.term.Term.TermVisitor;
import com.lambdacalc.term.Term.Variable;

/**
 * term[target := replacement], by structural recursion.
 *
 * A binder with the target's name shadows it: the abstraction comes back
 * unchanged. In {@link SubstitutionMode#CAPTURING} mode no binder is ever
 * renamed, so a free variable of the replacement may end up bound:
 *
 *   (\y.x)[x := y] = (\y.y)
 *
 * {@link SubstitutionMode#HYGIENIC} renames such a binder first:
 *
 *   (\y.x)[x := y] = (\y1.y)
 */
final class Substitution implements TermVisitor<TermInterface> {

    private final Variable target;
    private final TermInterface replacement;
    private final SubstitutionMode mode;

    private Set<String> replacementFree; // only computed in hygienic mode

    Substitution(Variable target, TermInterface replacement, SubstitutionMode mode) {
        this.target = target;
        this.replacement = replacement;
        this.mode = mode;
    }

    static TermInterface substitute(TermInterface term, Variable target, TermInterface replacement, SubstitutionMode mode) {
        return term.accept(new Substitution(target, replacement, mode));
    }

    @Override
    public TermInterface visitVariable(Variable t) {
        return t.sameName(target) ? replacement : t;
    }

    @Override
    public TermInterface visitAbstraction(Abstraction t) {
        if (t.parameter.sameName(target)) return t;

        if (mode == SubstitutionMode.HYGIENIC && capturesReplacement(t)) {
            Variable fresh = new Variable(freshName(t));
            TermInterface renamed = substitute(t.body, t.parameter, fresh, mode);
            return new Abstraction(fresh, renamed.accept(this));
        }

        return new Abstraction(t.parameter, t.body.accept(this));
    }

    @Override
    public TermInterface visitApplication(Application t) {
        return new Application(t.function.accept(this), t.argument.accept(this));
    }

    // -------------------------
    // Hygiene
    // -------------------------

    private boolean capturesReplacement(Abstraction t) {
        if (replacementFree == null) replacementFree = FreeVariables.of(replacement);
        return replacementFree.contains(t.parameter.name)
                && FreeVariables.occursFree(target.name, t.body);
    }

    /** Parameter name plus the smallest positive suffix free in both body and replacement. */
    private String freshName(Abstraction t) {
        Set<String> avoid = new HashSet<>(replacementFree);
        avoid.addAll(FreeVariables.of(t.body));
        avoid.add(target.name);
        for (int i = 1; ; i++) {
            String candidate = t.parameter.name + i;
            if (!avoid.contains(candidate)) return candidate;
        }
    }
}
