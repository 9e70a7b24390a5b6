import org.junit.jupiter.api.Test;

import com.lambdacalc.library.Combinators;
import com.lambdacalc.library.Naturals;
import com.lambdacalc.reduce.FixpointDriver;
import com.lambdacalc.reduce.Reducer;
import com.lambdacalc.reduce.ReductionResult;
import com.lambdacalc.reduce.StopCondition;
import com.lambdacalc.term.Term.TermInterface;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.lambdacalc.term.TermBuilder.app;
import static com.lambdacalc.term.TermBuilder.var;
import static org.junit.jupiter.api.Assertions.*;

public class FixpointDriverTest {

    private static final String FOUR = "(\\f.(\\x.[f [f [f [f x]]]]))";

    /** Y I cycles between two renderings forever. */
    private static TermInterface looping() {
        return app(Combinators.y(), Combinators.i());
    }

    @Test
    void addTwoTwo_reachesChurchFour() {
        TermInterface sum = app(Naturals.plus(), Naturals.nat(2), Naturals.nat(2));
        ReductionResult r = new FixpointDriver().run(sum);

        assertTrue(r.converged());
        assertEquals(FOUR, r.render());
        assertEquals(Naturals.nat(4).render(), r.render());
        assertEquals(6, r.steps());
        assertSame(sum, r.start());
    }

    @Test
    void kCombinator_keepsFirstArgument() {
        Reducer reducer = new Reducer();
        FixpointDriver driver = new FixpointDriver(reducer);

        TermInterface a = app(Naturals.succ(), Naturals.one());
        TermInterface b = Combinators.omega();
        TermInterface ka = reducer.apply(reducer.apply(Combinators.k(), a), b);

        assertEquals(driver.run(a).render(), driver.run(ka).render());
        assertEquals("(\\f.(\\x.[f [f x]]))", driver.run(ka).render());
    }

    @Test
    void omega_isReportedStuckAfterOneStep() {
        ReductionResult r = new FixpointDriver().run(Combinators.omega());
        assertTrue(r.converged());
        assertEquals(1, r.steps());
        assertEquals(Combinators.omega().render(), r.render());
    }

    @Test
    void normalForm_convergesImmediately_andIsStable() {
        TermInterface four = Naturals.nat(4);
        ReductionResult first = new FixpointDriver().run(four);
        ReductionResult second = new FixpointDriver().run(first.term());

        assertEquals(1, first.steps());
        assertEquals(four.render(), first.render());
        assertEquals(first.render(), second.render());
    }

    @Test
    void listener_seesEveryIntermediateForm() {
        List<String> seen = new ArrayList<>();
        List<Integer> steps = new ArrayList<>();
        FixpointDriver driver = new FixpointDriver().listener((step, term) -> {
            steps.add(step);
            seen.add(term.render());
        });

        ReductionResult r = driver.run(app(Naturals.plus(), Naturals.nat(2), Naturals.nat(2)));

        assertEquals(List.of(1, 2, 3, 4, 5), steps);
        assertEquals(FOUR, seen.get(seen.size() - 1));
        assertEquals(r.steps() - 1, seen.size());
    }

    @Test
    void stepBudget_cutsOffNonTerminatingTerm() {
        ReductionResult r = new FixpointDriver().run(looping(), 10);
        assertFalse(r.converged());
        assertTrue(r.stopped());
        assertEquals(10, r.steps());
    }

    @Test
    void nonPositiveBudget_isUnbounded() {
        ReductionResult r = new FixpointDriver().run(app(var("z"), var("w")), 0);
        assertTrue(r.converged());
        assertEquals("[z w]", r.render());
    }

    @Test
    void stopPredicate_canInspectTheCurrentTerm() {
        FixpointDriver driver = new FixpointDriver()
                .stopWhen((step, current) -> current.render().length() > 45);

        ReductionResult r = driver.run(looping());
        assertTrue(r.stopped());
        assertTrue(r.render().length() > 45);
    }

    @Test
    void deadline_stopsTheLoop() throws InterruptedException {
        StopCondition deadline = StopCondition.deadline(Duration.ofNanos(1));
        Thread.sleep(2);

        ReductionResult r = new FixpointDriver().stopWhen(deadline).run(looping());
        assertTrue(r.stopped());
        assertEquals(0, r.steps());
        assertEquals(looping().render(), r.render());
    }

    @Test
    void stopConditions_compose() {
        StopCondition budget = StopCondition.maxSteps(3);
        StopCondition either = StopCondition.never().or(budget);

        assertFalse(StopCondition.never().shouldStop(1_000_000, var("x")));
        assertFalse(either.shouldStop(2, var("x")));
        assertTrue(either.shouldStop(3, var("x")));
        assertFalse(StopCondition.maxSteps(0).shouldStop(99, var("x")));
        assertFalse(StopCondition.deadline(null).shouldStop(0, var("x")));
    }
}
