import org.junit.jupiter.api.Test;

import com.lambdacalc.library.Combinators;
import com.lambdacalc.reduce.FixpointDriver;
import com.lambdacalc.reduce.Reducer;
import com.lambdacalc.reduce.ReductionTrace;
import com.lambdacalc.reduce.SubstitutionMode;
import com.lambdacalc.term.AlphaEquivalence;
import com.lambdacalc.term.FreeVariables;
import com.lambdacalc.term.Term;
import com.lambdacalc.term.Term.TermInterface;

import java.util.List;
import java.util.Set;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.lam;
import static com.lambdacalc.term.TermBuilder.var;
import static org.junit.jupiter.api.Assertions.*;

public class AlphaEquivalenceTest {

    @Test
    void deBruijn_indicesCountOutwardFromInnermostBinder() {
        assertEquals("(\\.0)", AlphaEquivalence.toDeBruijn(lam("x", var("x"))));
        assertEquals("(\\.(\\.1))", AlphaEquivalence.toDeBruijn(Combinators.k()));
        assertEquals("(\\.[0 $z])", AlphaEquivalence.toDeBruijn(lam("y", app(var("y"), var("z")))));
        // inner binder shadows the outer one
        assertEquals("(\\.(\\.0))", AlphaEquivalence.toDeBruijn(lam("x x", var("x"))));
    }

    @Test
    void renamedBinders_areEquivalentButRenderDifferently() {
        TermInterface a = lam("x y", app(var("x"), var("y")));
        TermInterface b = lam("p q", app(var("p"), var("q")));

        assertTrue(AlphaEquivalence.equivalent(a, b));
        assertFalse(Term.sameRendering(a, b));
        assertFalse(Term.structurallyEqual(a, b));
    }

    @Test
    void differentBindingStructure_isNotEquivalent() {
        assertFalse(AlphaEquivalence.equivalent(lam("x y", var("x")), lam("x y", var("y"))));
        assertFalse(AlphaEquivalence.equivalent(lam("x", var("z")), lam("x", var("w"))));
        assertFalse(AlphaEquivalence.equivalent(var("x"), lam("x", var("x"))));
    }

    @Test
    void hygienicResult_isEquivalentToTheExpectedTerm() {
        Reducer hygienic = new Reducer(SubstitutionMode.HYGIENIC, ReductionTrace.NONE);
        TermInterface r = new FixpointDriver(hygienic).run(app(Combinators.k(), var("y"))).term();

        assertEquals("(\\y1.y)", r.render());
        assertTrue(AlphaEquivalence.equivalent(lam("z", var("y")), r));
    }

    @Test
    void freeVariables_inFirstOccurrenceOrder() {
        TermInterface t = app(lam("x", app(var("x"), var("b"))), app(var("a"), var("b")));
        assertEquals(List.of("b", "a"), List.copyOf(FreeVariables.of(t)));
        assertTrue(FreeVariables.occursFree("a", t));
        assertFalse(FreeVariables.occursFree("x", t));
        assertFalse(FreeVariables.isClosed(t));
        assertTrue(FreeVariables.isClosed(Combinators.s()));
    }

    @Test
    void allNames_includesBinders() {
        Set<String> names = FreeVariables.allNames(lam("x", app(var("x"), var("y"))));
        assertEquals(List.of("x", "y"), List.copyOf(names));
    }
}
