package net.littleredcomputer.satornot;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.satornot.sat.AbstractSATSolver;
import net.littleredcomputer.satornot.sat.Solvers;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

/**
 * Timing and satisfiability rate over repeated generate, render, solve rounds, for
 * choosing puzzle parameters that give a fair mix of SAT and UNSAT instances.
 */
public final class Stats {
    private Stats() {}

    public static final class Summary {
        private final int n, m, k, iterations;
        private final Duration generation, rendering, solving;
        private final int satCount;
        private final Formula exampleSat, exampleUnsat;

        private Summary(int n, int m, int k, int iterations, Duration generation, Duration rendering, Duration solving,
                        int satCount, Formula exampleSat, Formula exampleUnsat) {
            this.n = n;
            this.m = m;
            this.k = k;
            this.iterations = iterations;
            this.generation = generation;
            this.rendering = rendering;
            this.solving = solving;
            this.satCount = satCount;
            this.exampleSat = exampleSat;
            this.exampleUnsat = exampleUnsat;
        }

        public int iterations() { return iterations; }
        public int satCount() { return satCount; }
        public double satPercentage() { return 100.0 * satCount / iterations; }
        public Duration generationTime() { return generation; }
        public Duration renderingTime() { return rendering; }
        public Duration solvingTime() { return solving; }
        public Optional<Formula> exampleSat() { return Optional.ofNullable(exampleSat); }
        public Optional<Formula> exampleUnsat() { return Optional.ofNullable(exampleUnsat); }

        @Override
        public String toString() {
            return String.format("Stats for %d variables, %d variables per clause, %d clauses%n", n, m, k)
                    + String.format("Total generation time: %.2fs%n", seconds(generation))
                    + String.format("Total rendering time: %.2fs%n", seconds(rendering))
                    + String.format("Total solving time: %.2fs%n", seconds(solving))
                    + String.format("Percentage of SAT instances: %.2f%%%n", satPercentage())
                    + "Example SAT instance: " + (exampleSat == null ? "none" : exampleSat.encode()) + "\n"
                    + "Example UNSAT instance: " + (exampleUnsat == null ? "none" : exampleUnsat.encode());
        }

        private static double seconds(Duration d) {
            return d.toNanos() / 1e9;
        }
    }

    public static Summary run(int n, int m, int k, int iterations, Random random) {
        return run(n, m, k, iterations, random, Solvers.defaultSolver());
    }

    public static Summary run(int n, int m, int k, int iterations, Random random, Function<Formula, AbstractSATSolver> solver) {
        if (iterations <= 0) throw new IllegalArgumentException("iterations must be positive");
        InstanceGenerator generator = new InstanceGenerator(random);
        Stopwatch gen = Stopwatch.createUnstarted();
        Stopwatch render = Stopwatch.createUnstarted();
        Stopwatch solve = Stopwatch.createUnstarted();
        int satCount = 0;
        Formula exampleSat = null;
        Formula exampleUnsat = null;

        for (int i = 0; i < iterations; ++i) {
            gen.start();
            Formula f = generator.generate(n, m, k);
            gen.stop();

            // Formulas over more variables than have names are timed without rendering.
            if (f.cardinality() <= Renderer.MAX_VARIABLES) {
                render.start();
                Renderer.render(f);
                render.stop();
            }

            solve.start();
            boolean sat = solver.apply(f).solve().isPresent();
            solve.stop();

            if (sat) {
                ++satCount;
                if (exampleSat == null) exampleSat = f;
            } else if (exampleUnsat == null) {
                exampleUnsat = f;
            }
        }
        return new Summary(n, m, k, iterations, gen.elapsed(), render.elapsed(), solve.elapsed(),
                satCount, exampleSat, exampleUnsat);
    }
}
