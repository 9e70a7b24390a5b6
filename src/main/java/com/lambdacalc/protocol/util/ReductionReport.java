package com.lambdacalc.protocol.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.lambdacalc.reduce.ReductionResult;
import com.lambdacalc.term.Term;

/** JSON summary of one fixpoint run. */
public final class ReductionReport {

    private ReductionReport() {}

    public static ObjectNode toJson(ReductionResult r) {
        ObjectNode n = TermJson.mapper().createObjectNode();
        n.put("main", r.start().render());
        n.put("result", r.term().render());
        n.put("steps", r.steps());
        n.put("converged", r.converged());
        n.put("stopped", r.stopped());
        n.put("size", Term.size(r.term()));
        n.put("elapsedMs", r.elapsed().toMillis());
        n.set("tree", TermJson.toJson(r.term()));
        return n;
    }

    public static String toPrettyString(ReductionResult r) {
        try {
            return TermJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(toJson(r));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("ReductionReport: failed to write report", e);
        }
    }
}
