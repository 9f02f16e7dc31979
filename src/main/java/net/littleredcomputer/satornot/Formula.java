package net.littleredcomputer.satornot;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * A formula in conjunctive normal form: the conjunction of an ordered list of clauses.
 * <p>
 * Variables are numbered 1..N with no gaps: every variable up to the largest one
 * mentioned must occur in some clause. Formulas are immutable.
 */
public final class Formula {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter spaceSplitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private final static Splitter commaSplitter = Splitter.on(',');
    private final static Joiner commaJoiner = Joiner.on(',');

    private final ImmutableList<Clause> clauses;
    private final int nVariables;

    private Formula(ImmutableList<Clause> clauses) {
        if (clauses.isEmpty()) throw new IllegalArgumentException("Must have at least one clause");
        int n = 0;
        long nLiterals = 0;
        for (Clause c : clauses) {
            n = Math.max(n, c.maxVariable());
            nLiterals += c.size();
        }
        // Dense numbering needs at least one literal per variable.
        if (n > nLiterals) throw new IllegalArgumentException("variable " + n + " used, but only " + nLiterals + " literals present");
        BitSet seen = new BitSet(n + 1);
        for (Clause c : clauses) for (int l : c.literals()) seen.set(Math.abs(l));
        int gap = seen.nextClearBit(1);
        if (gap <= n) throw new IllegalArgumentException("variable " + gap + " does not occur, but " + n + " does");
        this.clauses = clauses;
        this.nVariables = n;
    }

    public static Formula of(Iterable<Clause> clauses) {
        return new Formula(ImmutableList.copyOf(clauses));
    }

    public static Formula of(Clause... clauses) {
        return new Formula(ImmutableList.copyOf(clauses));
    }

    /**
     * Convenience for tests and fixtures: each array is one clause.
     */
    public static Formula of(int[]... clauses) {
        return new Formula(Arrays.stream(clauses).map(Clause::of).collect(ImmutableList.toImmutableList()));
    }

    public List<Clause> clauses() {
        return clauses;
    }

    public int nClauses() {
        return clauses.size();
    }

    public Clause getClause(int i) {
        return clauses.get(i);
    }

    /** @return the number of variables N, which is the largest literal magnitude */
    public int cardinality() {
        return nVariables;
    }

    /** @return the length of the longest clause */
    public int width() {
        return clauses.stream().mapToInt(Clause::size).max().orElse(0);
    }

    /** True iff every clause has a true literal under a. */
    public boolean isSatisfiedBy(Assignment a) {
        for (Clause c : clauses) if (!c.isSatisfiedBy(a)) return false;
        return true;
    }

    /** True iff some clause has only false literals under a. */
    public boolean isFalsifiedBy(Assignment a) {
        for (Clause c : clauses) if (c.isFalsifiedBy(a)) return true;
        return false;
    }

    /**
     * Evaluate the boolean function represented by the clauses at the specified point
     * @param p point (i.e., vector of booleans, variable 1 first) at which to evaluate
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        if (p.length < nVariables) throw new IllegalArgumentException("point has " + p.length + " coordinates, need " + nVariables);
        for (Clause c : clauses) {
            // Any false clause is enough to spoil satisfaction.
            if (!c.evaluate(p)) return false;
        }
        return true;
    }

    /** @return one string per clause, in clause order, as by {@link Clause#encode()} */
    public List<String> encodeClauses() {
        return clauses.stream().map(Clause::encode).collect(Collectors.toList());
    }

    /** @return the clause encodings joined by ',', e.g. "1.-2.3,2.3.-1" */
    public String encode() {
        return commaJoiner.join(encodeClauses());
    }

    public static Formula parse(String s) {
        return parse(commaSplitter.splitToList(s));
    }

    public static Formula parse(List<String> encodedClauses) {
        return new Formula(encodedClauses.stream().map(Clause::parse).collect(ImmutableList.toImmutableList()));
    }

    public static Formula parseDimacs(String s) {
        return parseDimacs(new StringReader(s));
    }

    /**
     * Read a formula in DIMACS CNF format. The variable count in the p line must agree
     * with the largest variable used, and every variable must be used.
     */
    public static Formula parseDimacs(Reader r) {
        List<Integer> literals = new ArrayList<>();
        List<Clause> clauses = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines().filter(s -> !s.startsWith("c")).iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        ls.forEachRemaining(line -> StreamSupport.stream(spaceSplitter.split(line).spliterator(), false)
                .mapToInt(Integer::parseInt)
                .forEach(l -> {
                    if (l == 0) {
                        if (literals.isEmpty())
                            throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
                        clauses.add(Clause.of(literals));
                        literals.clear();
                    } else {
                        if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds");
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (clauses.size() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        Formula f = new Formula(ImmutableList.copyOf(clauses));
        if (f.cardinality() != nVar) {
            throw new IllegalArgumentException("p header declares " + nVar + " variables, but " + f.cardinality() + " are used");
        }
        return f;
    }

    public String toDimacs() {
        StringBuilder sb = new StringBuilder();
        sb.append("p cnf ").append(nVariables).append(' ').append(clauses.size()).append('\n');
        for (Clause c : clauses) {
            for (int l : c.literals()) sb.append(l).append(' ');
            sb.append("0\n");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        return clauses.equals(((Formula) o).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        return encode();
    }
}
