package net.littleredcomputer.satornot;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A disjunction of literals. Literal order is significant: two clauses are equal only if
 * they hold the same literals with the same signs in the same order.
 */
public final class Clause {
    private static final Joiner dotJoiner = Joiner.on('.');
    private static final Splitter dotSplitter = Splitter.on('.').trimResults();

    private final ImmutableList<Integer> literals;

    private Clause(ImmutableList<Integer> literals) {
        if (literals.isEmpty()) throw new IllegalArgumentException("Empty clause");
        for (int l : literals) {
            if (l == 0) throw new IllegalArgumentException("invalid literal");
            // -2^31 has no positive counterpart.
            if (l == Integer.MIN_VALUE) throw new IllegalArgumentException("literal out of range: " + l);
        }
        this.literals = literals;
    }

    public static Clause of(int... literals) {
        ImmutableList.Builder<Integer> b = ImmutableList.builderWithExpectedSize(literals.length);
        for (int l : literals) b.add(l);
        return new Clause(b.build());
    }

    public static Clause of(Iterable<Integer> literals) {
        return new Clause(ImmutableList.copyOf(literals));
    }

    public List<Integer> literals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public int get(int i) {
        return literals.get(i);
    }

    /** @return the largest variable number mentioned in this clause */
    public int maxVariable() {
        int max = 0;
        for (int l : literals) max = Math.max(max, Math.abs(l));
        return max;
    }

    /** True iff some literal is true under a. Open literals are not a witness. */
    public boolean isSatisfiedBy(Assignment a) {
        for (int l : literals) if (a.evaluate(l) == Truth.TRUE) return true;
        return false;
    }

    /** True iff every literal is false under a. */
    public boolean isFalsifiedBy(Assignment a) {
        for (int l : literals) if (a.evaluate(l) != Truth.FALSE) return false;
        return true;
    }

    boolean evaluate(boolean[] p) {
        for (int l : literals) {
            if (p[Math.abs(l) - 1] == (l > 0)) return true;
        }
        return false;
    }

    /** @return the literals joined by '.', e.g. "1.-2.3" */
    public String encode() {
        return dotJoiner.join(literals);
    }

    public static Clause parse(String s) {
        ImmutableList.Builder<Integer> b = ImmutableList.builder();
        for (String part : dotSplitter.split(s)) {
            try {
                b.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("malformed clause: " + s, e);
            }
        }
        return new Clause(b.build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        return literals.equals(((Clause) o).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return literals.toString();
    }
}
