package net.littleredcomputer.satornot.sat;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.satornot.Assignment;
import net.littleredcomputer.satornot.Formula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common state for a single satisfiability search over one formula: step counting
 * and throttled progress logging. A solver instance is meant to be used by one thread.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    final Formula formula;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public AbstractSATSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    AbstractSATSolver(String name, Formula formula) {
        this.name = name;
        this.formula = formula;
    }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    void stop(boolean satisfiable) {
        if (stopwatch.isRunning()) stopwatch.stop();
        log.debug("%s %s after %d steps in %s", name, satisfiable ? "SAT" : "UNSAT", stepCount, stopwatch);
    }

    public long stepCount() {
        return stepCount;
    }

    public String name() {
        return name;
    }

    void step(Assignment a) {
        ++stepCount;
        if (stepCount % logCheckSteps == 0) maybeReportProgress(a::encode);
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /**
     * Decide the formula.
     *
     * @return a satisfying assignment, in which unassigned variables may take either value,
     * or empty if the formula is unsatisfiable
     */
    public abstract Optional<Assignment> solve();
}
