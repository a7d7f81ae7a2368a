package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {
    private static final Pattern langfordRe = Pattern.compile("langford(\\d+)");
    private static final Pattern waerdenRe = Pattern.compile("waerden(\\d+),(\\d+),(\\d+)");
    private static final Pattern holeRe = Pattern.compile("hole(\\d+)");

    private static Options options() {
        return new Options()
                .addOption("task", true, "what to do with the problem: solve (default) or print")
                .addOption("problem", true, "filename of problem description, - for stdin, or a generator: langfordN, waerdenJ,K,N, holeN")
                .addOption("format", true, "format of problem file: cnf (default) or lines")
                .addOption("algorithm", true, "solver: dpll (default) or exhaustive")
                .addOption("heuristic", true, "branching heuristic for dpll: occurrence (default) or fixed")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    static Formula formula(CommandLine cmd) throws IOException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        Matcher lm = langfordRe.matcher(p);
        if (lm.matches()) return Problems.langford(Integer.parseInt(lm.group(1)));
        Matcher wm = waerdenRe.matcher(p);
        if (wm.matches()) {
            return Problems.waerden(Integer.parseInt(wm.group(1)),
                    Integer.parseInt(wm.group(2)),
                    Integer.parseInt(wm.group(3)));
        }
        Matcher hm = holeRe.matcher(p);
        if (hm.matches()) return Problems.pigeonhole(Integer.parseInt(hm.group(1)));
        // Didn't match a canned problem generator; try a file
        String format = cmd.getOptionValue("format", "cnf");
        if (!format.equals("cnf") && !format.equals("lines")) throw new IllegalArgumentException("unknown problem format");
        try (Reader r = problem(cmd)) {
            return format.equals("cnf") ? Formula.parseFrom(r) : Formula.parseLines(r);
        }
    }

    static Function<Formula, AbstractSATSolver> solver(CommandLine cmd) {
        String a = cmd.getOptionValue("algorithm", "dpll");
        switch (a) {
            case "dpll": {
                Heuristic h = Heuristic.fromName(cmd.getOptionValue("heuristic", "occurrence"));
                return f -> new DPLLSolver(f, h);
            }
            case "exhaustive": return ExhaustiveSolver::new;
            default: throw new IllegalArgumentException("Unknown algorithm: " + a);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    /**
     * Write the outcome in the style of the SAT competitions: an "s" status line and, when
     * satisfiable, a "v" line listing each variable as a signed literal.
     */
    static void printOutcome(Optional<Map<Integer, Boolean>> outcome, PrintStream out) {
        if (outcome.isPresent()) {
            out.println("s SATISFIABLE");
            out.print("v ");
            outcome.get().forEach((v, b) -> out.printf("%d ", b ? v : -v));
            out.println("0");
        } else {
            out.println("s UNSATISFIABLE");
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        String task = cmd.getOptionValue("task", "solve");
        switch (task) {
            case "solve": {
                Formula f = formula(cmd);
                Stopwatch sw = Stopwatch.createStarted();
                AbstractSATSolver s = solver(cmd).apply(f);
                s.setLogInterval(logInterval(cmd));
                Optional<Map<Integer, Boolean>> outcome = s.solve();
                sw.stop();
                System.out.println("c " + sw);
                printOutcome(outcome, System.out);
                break;
            }
            case "print":
                formula(cmd).toDimacs(System.out, cmd.getOptionValue("problem"));
                break;
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
