package net.littleredcomputer.satornot;

import net.littleredcomputer.satornot.sat.AbstractSATSolver;
import net.littleredcomputer.satornot.sat.Solvers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.function.Function;

/**
 * One round of the game: a formula the player must call SAT or NOT SAT.
 */
public class Puzzle {
    private static final Logger log = LogManager.getFormatterLogger(Puzzle.class);
    public static final int VARIABLES = 3;
    public static final int ARITY = 3;
    public static final int CLAUSES = 6;

    private final Formula formula;

    public Puzzle(Formula formula) {
        this.formula = formula;
    }

    /** A fresh puzzle of {@link #CLAUSES} clauses of {@link #ARITY} literals over {@link #VARIABLES} variables. */
    public static Puzzle random(InstanceGenerator generator) {
        return new Puzzle(generator.generate(VARIABLES, ARITY, CLAUSES));
    }

    /** Restore a puzzle from the text produced by {@link #encode()}. */
    public static Puzzle parse(String encoded) {
        return new Puzzle(Formula.parse(encoded));
    }

    public Formula formula() {
        return formula;
    }

    public String encode() {
        return formula.encode();
    }

    public Verdict check(Guess guess) {
        return check(guess, Solvers.defaultSolver());
    }

    public Verdict check(Guess guess, Function<Formula, AbstractSATSolver> solver) {
        Optional<Assignment> witness = solver.apply(formula).solve();
        Verdict v = new Verdict(guess, witness);
        log.debug("%s: %s", formula, v);
        return v;
    }
}
