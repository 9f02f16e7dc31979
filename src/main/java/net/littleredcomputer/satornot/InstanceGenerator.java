package net.littleredcomputer.satornot;

import com.google.common.primitives.Ints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Draws random CNF formulas from an explicit source of randomness, so that a seeded
 * {@link Random} reproduces the same formulas.
 */
public class InstanceGenerator {
    private static final Logger log = LogManager.getFormatterLogger(InstanceGenerator.class);
    private final Random random;
    private long maxDraws = Long.MAX_VALUE;

    public InstanceGenerator(Random random) {
        this.random = random;
    }

    /**
     * Limit the number of clause draws (accepted or rejected as duplicates) one call to
     * {@link #generate} may make before giving up.
     */
    public InstanceGenerator setMaxDraws(long maxDraws) {
        if (maxDraws < 1) throw new IllegalArgumentException("maxDraws must be positive");
        this.maxDraws = maxDraws;
        return this;
    }

    /**
     * Generate a random m-SAT instance. Each literal's variable is uniform in [1,n], so a
     * variable may repeat within a clause, and each literal is negated with probability 1/2.
     * A clause identical (same literals in the same order) to an earlier one is redrawn.
     * <p>
     * If some variables of [1,n] are never drawn, the remaining ones are renumbered onto
     * 1..N in their original order, so the result always has dense variable numbering.
     *
     * @param n number of variables to draw from
     * @param m number of literals per clause
     * @param k number of clauses
     * @return random formula with k distinct clauses of size m and cardinality at most n
     */
    public Formula generate(int n, int m, int k) {
        if (n <= 0) throw new IllegalArgumentException("n must be positive!");
        if (m <= 0) throw new IllegalArgumentException("m must be positive!");
        if (k <= 0) throw new IllegalArgumentException("k must be positive!");
        // There are (2n)^m distinct clauses to choose from.
        if (Math.pow(2.0 * n, m) < k) {
            throw new IllegalArgumentException(String.format("only %.0f distinct clauses of size %d exist over %d variables; %d requested",
                    Math.pow(2.0 * n, m), m, n, k));
        }
        Set<List<Integer>> used = new HashSet<>();
        List<int[]> clauses = new ArrayList<>(k);
        long draws = 0;
        while (clauses.size() < k) {
            if (draws++ == maxDraws) {
                throw new IllegalStateException("gave up after " + maxDraws + " draws with " + clauses.size() + " of " + k + " clauses");
            }
            int[] clause = new int[m];
            for (int j = 0; j < m; ++j) {
                int v = 1 + random.nextInt(n);
                clause[j] = random.nextBoolean() ? v : -v;
            }
            if (!used.add(Ints.asList(clause))) continue;
            clauses.add(clause);
        }
        log.debug("generated %d clauses in %d draws", k, draws);
        return compact(n, clauses);
    }

    /**
     * Generate a random 3-SAT instance in which each clause mentions three distinct variables.
     *
     * @param n number of variables (at least 3)
     * @param k number of clauses
     */
    public Formula generate3SAT(int n, int k) {
        if (n < 3) throw new IllegalArgumentException("3-SAT needs at least 3 variables");
        if (k <= 0) throw new IllegalArgumentException("k must be positive!");
        List<Integer> variables = new ArrayList<>(n);
        for (int v = 1; v <= n; ++v) variables.add(v);
        List<int[]> clauses = new ArrayList<>(k);
        for (int j = 0; j < k; ++j) {
            Collections.shuffle(variables, random);
            int[] clause = new int[3];
            for (int i = 0; i < 3; ++i) {
                int v = variables.get(i);
                clause[i] = random.nextBoolean() ? v : -v;
            }
            clauses.add(clause);
        }
        return compact(n, clauses);
    }

    // Renumber the variables actually used onto 1..N, preserving their order.
    private static Formula compact(int n, List<int[]> clauses) {
        int[] rename = new int[n + 1];
        for (int[] c : clauses) for (int l : c) rename[Math.abs(l)] = 1;
        for (int v = 1, next = 1; v <= n; ++v) {
            if (rename[v] != 0) rename[v] = next++;
        }
        List<Clause> cs = new ArrayList<>(clauses.size());
        for (int[] c : clauses) {
            int[] renamed = new int[c.length];
            for (int i = 0; i < c.length; ++i) renamed[i] = Integer.signum(c[i]) * rename[Math.abs(c[i])];
            cs.add(Clause.of(renamed));
        }
        return Formula.of(cs);
    }
}
