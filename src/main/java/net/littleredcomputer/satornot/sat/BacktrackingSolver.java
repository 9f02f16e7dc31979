package net.littleredcomputer.satornot.sat;

import net.littleredcomputer.satornot.Assignment;
import net.littleredcomputer.satornot.Formula;

import java.util.Optional;

/**
 * Naive chronological backtracking. At each node: succeed if every clause is satisfied,
 * fail if some clause is falsified, otherwise branch on the lowest unassigned variable,
 * trying true before false. No propagation is done, so the search is exponential in the
 * number of variables; recursion depth equals that number.
 */
public class BacktrackingSolver extends AbstractSATSolver {

    public BacktrackingSolver(Formula formula) {
        super("backtrack", formula);
    }

    @Override
    public Optional<Assignment> solve() {
        start();
        Assignment a = new Assignment(formula.cardinality());
        boolean sat = search(a);
        stop(sat);
        return sat ? Optional.of(a) : Optional.empty();
    }

    /**
     * On success a holds the witness. On failure a is exactly as it was on entry.
     */
    private boolean search(Assignment a) {
        step(a);
        if (formula.isSatisfiedBy(a)) return true;
        if (formula.isFalsifiedBy(a)) return false;
        int v = a.firstUnassigned();
        // With every variable assigned, each clause is either satisfied or falsified.
        if (v == 0) throw new IllegalStateException("no unassigned variables left");
        a.set(v, true);
        if (search(a)) return true;
        a.set(v, false);
        if (search(a)) return true;
        a.unassign(v);
        return false;
    }
}
