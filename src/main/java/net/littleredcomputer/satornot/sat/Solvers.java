package net.littleredcomputer.satornot.sat;

import net.littleredcomputer.satornot.Formula;

import java.util.function.Function;

/**
 * Solver factories by name, for command line selection.
 */
public final class Solvers {
    public static final String DEFAULT = "backtrack";

    private Solvers() {}

    public static Function<Formula, AbstractSATSolver> byName(String name) {
        switch (name) {
            case "backtrack": return BacktrackingSolver::new;
            case "iterative": return IterativeBacktrackingSolver::new;
            default: throw new IllegalArgumentException("Unknown algorithm: " + name);
        }
    }

    public static Function<Formula, AbstractSATSolver> defaultSolver() {
        return byName(DEFAULT);
    }
}
