package net.littleredcomputer.satornot.sat;

import net.littleredcomputer.satornot.Assignment;
import net.littleredcomputer.satornot.Formula;
import net.littleredcomputer.satornot.InstanceGenerator;
import org.junit.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class IterativeBacktrackingSolverTest extends SATTestBase {
    private final Function<Formula, AbstractSATSolver> I = IterativeBacktrackingSolver::new;

    @Test public void ex6() { assertUNSAT(ex6, I); }
    @Test public void ex7() { assertSAT(ex7, I); }
    @Test public void ex152() { assertSAT(ex152, I); }

    @Test public void w3_3() { assertThat(waerdenNumber(3, 3, I), is(9)); }
    @Test public void w3_4() { assertThat(waerdenNumber(3, 4, I), is(18)); }

    @Test
    public void pigeonhole() {
        for (int n = 1; n <= 4; ++n) assertUNSAT(pigeonhole(n), I);
    }

    @Test
    public void bruteForce() { testAgainstBruteForceWith(I); }

    @Test
    public void contradictoryUnits() {
        assertThat(I.apply(Formula.of(new int[]{1}, new int[]{-1})).solve(), isEmpty());
    }

    @Test
    public void sameSearchAsRecursive() {
        InstanceGenerator g = new InstanceGenerator(new Random(7));
        for (int trial = 0; trial < 200; ++trial) {
            Formula f = g.generate(8, 3, 30);
            AbstractSATSolver recursive = new BacktrackingSolver(f);
            AbstractSATSolver iterative = I.apply(f);
            Optional<Assignment> expected = recursive.solve();
            assertThat(f.toString(), iterative.solve(), is(expected));
            assertThat(f.toString(), iterative.stepCount(), is(recursive.stepCount()));
        }
    }

    @Test
    public void deepChain() {
        // Satisfiable only with every variable true; the decision stack reaches depth n.
        final int n = 2000;
        int[][] clauses = new int[n][];
        clauses[0] = new int[]{1};
        for (int v = 2; v <= n; ++v) clauses[v - 1] = new int[]{-(v - 1), v};
        boolean[] allTrue = new boolean[n];
        Arrays.fill(allTrue, true);
        assertThat(I.apply(Formula.of(clauses)).solve(), isPresentAndIs(Assignment.of(allTrue)));
    }
}
