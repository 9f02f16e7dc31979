package net.littleredcomputer.satornot;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import net.littleredcomputer.satornot.sat.AbstractSATSolver;
import net.littleredcomputer.satornot.sat.Solvers;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

public class Main {
    private static final Joiner lineJoiner = Joiner.on('\n');

    private static Options options() {
        return new Options()
                .addOption("task", true, "generate, solve, verify or stats")
                .addOption("n", true, "number of variables")
                .addOption("m", true, "literals per clause")
                .addOption("k", true, "number of clauses")
                .addOption("seed", true, "random seed")
                .addOption("iterations", true, "number of instances for stats")
                .addOption("clauses", true, "encoded formula, e.g. 1.-2.3,2.3.-1")
                .addOption("problem", true, "filename of DIMACS problem, or - for stdin")
                .addOption("guess", true, "SAT or NOT_SAT")
                .addOption("algorithm", true, "backtrack or iterative")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static int intOption(CommandLine cmd, String name, int defaultValue) {
        String v = cmd.getOptionValue(name);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("-" + name + " must be an integer: " + v, e);
        }
    }

    private static Random random(CommandLine cmd) {
        return cmd.hasOption("seed") ? new Random(Long.parseLong(cmd.getOptionValue("seed"))) : new Random();
    }

    private static Formula formula(CommandLine cmd) throws FileNotFoundException {
        if (cmd.hasOption("clauses")) return Formula.parse(cmd.getOptionValue("clauses"));
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -clauses or -problem");
        String p = cmd.getOptionValue("problem");
        return Formula.parseDimacs(new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p)));
    }

    private static Function<Formula, AbstractSATSolver> solver(CommandLine cmd) {
        Function<Formula, AbstractSATSolver> s = Solvers.byName(cmd.getOptionValue("algorithm", Solvers.DEFAULT));
        Duration interval = Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
        return s.andThen(solver -> solver.setLogInterval(interval));
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        switch (task) {
            case "generate": {
                Formula f = new InstanceGenerator(random(cmd)).generate(
                        intOption(cmd, "n", Puzzle.VARIABLES),
                        intOption(cmd, "m", Puzzle.ARITY),
                        intOption(cmd, "k", Puzzle.CLAUSES));
                System.out.println(f.encode());
                if (f.cardinality() <= Renderer.MAX_VARIABLES) System.out.println(Renderer.render(f));
                break;
            }
            case "solve": {
                Formula f = formula(cmd);
                Stopwatch sw = Stopwatch.createStarted();
                Optional<Assignment> outcome = solver(cmd).apply(f).solve();
                sw.stop();
                System.out.println("c " + sw);
                if (outcome.isPresent()) {
                    System.out.println("s SATISFIABLE");
                    System.out.print("v ");
                    Assignment a = outcome.get();
                    // Unassigned variables are free; report them as true.
                    for (int v = 1; v <= a.nVariables(); ++v) System.out.printf("%d ", a.get(v) == Truth.FALSE ? -v : v);
                    System.out.println("0");
                } else {
                    System.out.println("s UNSATISFIABLE");
                }
                break;
            }
            case "verify": {
                if (!cmd.hasOption("guess")) throw new IllegalArgumentException("Must specify -guess");
                Puzzle p = new Puzzle(formula(cmd));
                Verdict v = p.check(Guess.valueOf(cmd.getOptionValue("guess")), solver(cmd));
                System.out.println(lineJoiner.join(Renderer.renderLines(p.formula(), "|", "&")));
                System.out.println(Renderer.renderVerdict(v));
                break;
            }
            case "stats": {
                int n = intOption(cmd, "n", Puzzle.VARIABLES);
                int m = intOption(cmd, "m", Puzzle.ARITY);
                int k = intOption(cmd, "k", Puzzle.CLAUSES);
                System.out.println(Stats.run(n, m, k, intOption(cmd, "iterations", 1000), random(cmd), solver(cmd)));
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
