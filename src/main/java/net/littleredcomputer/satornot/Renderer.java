package net.littleredcomputer.satornot;

import com.google.common.base.Joiner;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable text for formulas, assignments and verdicts. Variables are named
 * a through z, so only formulas over at most {@link #MAX_VARIABLES} variables can
 * be rendered.
 */
public final class Renderer {
    public static final int MAX_VARIABLES = 26;
    public static final String OR = "∨";
    public static final String AND = "∧";
    private static final Joiner commaJoiner = Joiner.on(", ");

    private Renderer() {}

    public static String variableName(int variable) {
        if (variable < 1 || variable > MAX_VARIABLES) {
            throw new IllegalArgumentException("variable " + variable + " has no display name");
        }
        return String.valueOf((char) ('a' + variable - 1));
    }

    public static String literalName(int literal) {
        return literal < 0 ? "!" + variableName(-literal) : variableName(literal);
    }

    /** e.g. "(a | !b | c)" for the clause (1, -2, 3) and the symbol "|". */
    public static String renderClause(Clause clause, String or) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < clause.size(); ++i) {
            if (i > 0) sb.append(' ').append(or).append(' ');
            sb.append(literalName(clause.get(i)));
        }
        return sb.append(')').toString();
    }

    public static String renderClause(Clause clause) {
        return renderClause(clause, OR);
    }

    public static String render(Formula formula, String or, String and) {
        return Joiner.on(" " + and + " ").join(renderLines(formula, or, null));
    }

    public static String render(Formula formula) {
        return render(formula, OR, AND);
    }

    /**
     * One line per clause. When and is not null, every line after the first begins
     * with it, the way the clauses are stacked in the problem image.
     */
    public static List<String> renderLines(Formula formula, String or, String and) {
        List<String> lines = new ArrayList<>(formula.nClauses());
        for (Clause c : formula.clauses()) {
            String s = renderClause(c, or);
            lines.add(and != null && !lines.isEmpty() ? and + " " + s : s);
        }
        return lines;
    }

    /** e.g. "a=true, b=false, c=any"; unassigned variables may take either value. */
    public static String renderAssignment(Assignment a) {
        List<String> parts = new ArrayList<>(a.nVariables());
        for (int v = 1; v <= a.nVariables(); ++v) {
            Truth t = a.get(v);
            parts.add(variableName(v) + "=" + (t == Truth.UNASSIGNED ? "any" : t == Truth.TRUE ? "true" : "false"));
        }
        return commaJoiner.join(parts);
    }

    public static String renderVerdict(Verdict verdict) {
        String headline = verdict.isCorrect() ? "Correct!" : "WRONG";
        return verdict.witness()
                .map(w -> headline + "\nis SAT with model " + renderAssignment(w))
                .orElse(headline + "\nis UNSAT");
    }
}
