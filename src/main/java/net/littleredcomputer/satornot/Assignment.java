package net.littleredcomputer.satornot;

import java.util.Arrays;

/**
 * A partial map from the variables 1..n to truth values. Slot 0 exists only so that
 * variables can index the storage directly; it is never assigned.
 * <p>
 * Assignments are mutable and not thread safe. A solver owns its assignment for the
 * duration of a search.
 */
public class Assignment {
    private final Truth[] values;

    /**
     * Create an assignment over n variables, all unassigned.
     * @param nVariables number of variables (may be zero)
     */
    public Assignment(int nVariables) {
        if (nVariables < 0) throw new IllegalArgumentException("variable count must not be negative");
        values = new Truth[nVariables + 1];
        Arrays.fill(values, Truth.UNASSIGNED);
    }

    private Assignment(Truth[] values) {
        this.values = values;
    }

    public static Assignment of(boolean... bs) {
        Assignment a = new Assignment(bs.length);
        for (int i = 0; i < bs.length; ++i) a.values[i + 1] = Truth.of(bs[i]);
        return a;
    }

    public int nVariables() {
        return values.length - 1;
    }

    public Truth get(int variable) {
        checkVariable(variable);
        return values[variable];
    }

    public void set(int variable, boolean value) {
        checkVariable(variable);
        values[variable] = Truth.of(value);
    }

    public void unassign(int variable) {
        checkVariable(variable);
        values[variable] = Truth.UNASSIGNED;
    }

    /**
     * Evaluate a literal under this (possibly partial) assignment.
     *
     * @param literal a nonzero variable number, negative for the negated variable
     * @return the literal's truth value, {@link Truth#UNASSIGNED} if its variable is unassigned
     */
    public Truth evaluate(int literal) {
        if (literal == 0) throw new IllegalArgumentException("invalid literal");
        if (literal > 0) return get(literal);
        return get(-literal).not();
    }

    /** @return the lowest unassigned variable, or 0 if every variable has a value */
    public int firstUnassigned() {
        for (int v = 1; v < values.length; ++v) {
            if (values[v] == Truth.UNASSIGNED) return v;
        }
        return 0;
    }

    public boolean isComplete() {
        return firstUnassigned() == 0;
    }

    public Assignment copy() {
        return new Assignment(values.clone());
    }

    /**
     * Encode as one character per variable, starting with variable 1: T, F or U.
     */
    public String encode() {
        StringBuilder sb = new StringBuilder(nVariables());
        for (int v = 1; v < values.length; ++v) sb.append(values[v].code());
        return sb.toString();
    }

    public static Assignment parse(String s) {
        Truth[] vs = new Truth[s.length() + 1];
        vs[0] = Truth.UNASSIGNED;
        for (int i = 0; i < s.length(); ++i) vs[i + 1] = Truth.fromCode(s.charAt(i));
        return new Assignment(vs);
    }

    private void checkVariable(int variable) {
        if (variable < 1 || variable >= values.length) {
            throw new IllegalArgumentException("variable " + variable + " outside 1.." + nVariables());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        return Arrays.equals(values, ((Assignment) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return encode();
    }
}
