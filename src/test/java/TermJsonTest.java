import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.lambdacalc.library.Naturals;
import com.lambdacalc.protocol.util.ReductionReport;
import com.lambdacalc.protocol.util.TermJson;
import com.lambdacalc.reduce.FixpointDriver;
import com.lambdacalc.reduce.ReductionResult;
import com.lambdacalc.term.Term;
import com.lambdacalc.term.Term.TermInterface;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;
import static org.junit.jupiter.api.Assertions.*;

public class TermJsonTest {

    @Test
    void encodesEachShape() {
        ObjectNode n = TermJson.toJson(lam("x", app(var("x"), var("y"))));

        assertEquals("x", n.get("lam").asText());
        JsonNode body = n.get("body");
        assertTrue(body.get("app").isArray());
        assertEquals("x", body.get("app").get(0).get("var").asText());
        assertEquals("y", body.get("app").get(1).get("var").asText());
        assertEquals("{\"lam\":\"x\",\"body\":{\"app\":[{\"var\":\"x\"},{\"var\":\"y\"}]}}",
                TermJson.toJsonString(lam("x", app(var("x"), var("y")))));
    }

    @Test
    void decodesHandWrittenTree() {
        TermInterface t = TermJson.fromJsonString(
                "{\"app\":[{\"lam\":\"x\",\"body\":{\"var\":\"x\"}},{\"var\":\"y\"}]}");
        assertEquals("[(\\x.x) y]", t.render());
        assertTrue(Term.structurallyEqual(Naturals.nat(3), TermJson.fromJson(TermJson.toJson(Naturals.nat(3)))));
    }

    @Test
    void rejectsMalformedTrees() {
        assertThrows(IllegalArgumentException.class, () -> TermJson.fromJsonString("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> TermJson.fromJsonString("{\"lam\":\"x\"}"));
        assertThrows(IllegalArgumentException.class, () -> TermJson.fromJsonString("{\"app\":[{\"var\":\"x\"}]}"));
        assertThrows(IllegalArgumentException.class, () -> TermJson.fromJsonString("{\"var\":3}"));
        assertThrows(IllegalArgumentException.class, () -> TermJson.fromJsonString("{\"other\":1}"));
        assertThrows(IllegalArgumentException.class, () -> TermJson.fromJsonString("{not json"));
    }

    @Test
    void reportDescribesTheRun() {
        ReductionResult r = new FixpointDriver().run(app(Naturals.succ(), Naturals.one()));
        ObjectNode report = ReductionReport.toJson(r);

        assertEquals(r.start().render(), report.get("main").asText());
        assertEquals("(\\f.(\\x.[f [f x]]))", report.get("result").asText());
        assertEquals(3, report.get("steps").asInt());
        assertEquals(Term.size(r.term()), report.get("size").asInt());
        assertTrue(report.get("converged").asBoolean());
        assertFalse(report.get("stopped").asBoolean());
        assertEquals("f", report.get("tree").get("lam").asText());
        assertTrue(ReductionReport.toPrettyString(r).contains("\"converged\" : true"));
    }
}
