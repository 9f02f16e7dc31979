package net.littleredcomputer.satornot.sat;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import net.littleredcomputer.satornot.Assignment;
import net.littleredcomputer.satornot.Formula;
import net.littleredcomputer.satornot.Truth;

import java.util.Optional;

/**
 * The search of {@link BacktrackingSolver} with the recursion replaced by an explicit
 * stack of decision variables, so that stack depth does not grow with the number of
 * variables. Nodes are visited in the same order, so both solvers return the same
 * witness for any formula.
 */
public class IterativeBacktrackingSolver extends AbstractSATSolver {

    public IterativeBacktrackingSolver(Formula formula) {
        super("iterative", formula);
    }

    @Override
    public Optional<Assignment> solve() {
        start();
        final Assignment a = new Assignment(formula.cardinality());
        // Each entry is a decided variable. Its current value says which branch is
        // in progress: TRUE is the first, FALSE the second and last.
        final TIntStack decisions = new TIntArrayStack();
        int state = 1;

        while (true) {
            switch (state) {
                case 1: {  // Visit a node.
                    step(a);
                    if (formula.isSatisfiedBy(a)) {
                        stop(true);
                        return Optional.of(a);
                    }
                    if (formula.isFalsifiedBy(a)) {
                        state = 2;
                        continue;
                    }
                    int v = a.firstUnassigned();
                    if (v == 0) throw new IllegalStateException("no unassigned variables left");
                    a.set(v, true);
                    decisions.push(v);
                    continue;
                }
                case 2: {  // Try again, or backtrack.
                    if (decisions.size() == 0) {
                        stop(false);
                        return Optional.empty();
                    }
                    int v = decisions.peek();
                    if (a.get(v) == Truth.TRUE) {
                        a.set(v, false);
                        state = 1;
                        continue;
                    }
                    a.unassign(v);
                    decisions.pop();
                }
            }
        }
    }
}
