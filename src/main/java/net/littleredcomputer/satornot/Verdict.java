package net.littleredcomputer.satornot;

import java.util.Optional;

/**
 * The outcome of checking a guess against the solver.
 */
public final class Verdict {
    private final Guess guess;
    private final Assignment witness;

    Verdict(Guess guess, Optional<Assignment> witness) {
        this.guess = guess;
        this.witness = witness.map(Assignment::copy).orElse(null);
    }

    public Guess guess() {
        return guess;
    }

    /** @return a copy of the satisfying assignment found, if any */
    public Optional<Assignment> witness() {
        return Optional.ofNullable(witness).map(Assignment::copy);
    }

    public boolean isSatisfiable() {
        return witness != null;
    }

    public boolean isCorrect() {
        return isSatisfiable() == (guess == Guess.SAT);
    }

    @Override
    public String toString() {
        return guess + (isCorrect() ? " (correct)" : " (wrong)") + (isSatisfiable() ? " witness " + witness : " unsatisfiable");
    }
}
