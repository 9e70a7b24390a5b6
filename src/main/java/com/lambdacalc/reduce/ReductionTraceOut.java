package com.lambdacalc.reduce;

import java.util.List;

import com.lambdacalc.debug.Debug;
import com.lambdacalc.term.Term.TermInterface;

/** Forwards every core call to the debug hub at TRACE level. */
public final class ReductionTraceOut implements ReductionTrace {

    public static final String TAG = "lambda.trace";

    @Override
    public void step(Operation op, List<TermInterface> inputs, TermInterface result) {
        StringBuilder sb = new StringBuilder(op.name().toLowerCase());
        sb.append('(');
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(inputs.get(i).render());
        }
        sb.append(") = ").append(result.render());
        Debug.get().t(TAG, sb.toString());
    }
}
