package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * The Davis-Putnam-Logemann-Loveland procedure: unit propagation interleaved with
 * two-way branching and chronological backtracking.
 * <p>
 * The search is depth first. Each step works on its own simplified copy of the formula,
 * while a single valuation is shared by the whole search and overwritten in place as
 * literals are decided. Entries are never restored to "undecided" on backtracking; the
 * value left behind is simply the last one tried. Branch points live on an explicit
 * stack rather than the call stack, so deep searches cannot exhaust it.
 */
public class DPLLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(DPLLSolver.class);
    private final LiteralSelector selector;
    private long decisions;
    private long propagations;
    private long conflicts;

    public DPLLSolver(Formula formula) {
        this(formula, Heuristic.MAX_OCCURRENCE);
    }

    public DPLLSolver(Formula formula, LiteralSelector selector) {
        super("DPLL", formula);
        this.selector = Objects.requireNonNull(selector);
    }

    /** A point at which the search chose a literal and may have to come back to try its negation. */
    private static final class Branch {
        final Formula formula;  // the formula before the choice was made
        final int literal;  // the literal tried first
        boolean negated = false;  // set once the search has moved on to -literal

        Branch(Formula formula, int literal) {
            this.formula = formula;
            this.literal = literal;
        }
    }

    public long decisions() { return decisions; }
    public long propagations() { return propagations; }
    public long conflicts() { return conflicts; }

    @Override
    public Optional<Map<Integer, Boolean>> solve() {
        start();
        decisions = propagations = conflicts = 0;
        final Map<Integer, Boolean> valuation = new LinkedHashMap<>();
        for (int v : formula.variables()) valuation.put(v, false);
        final Deque<Branch> stack = new ArrayDeque<>();
        Formula f = formula;

        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) {
                final int depth = stack.size();
                final int clauses = f.nClauses();
                maybeReportProgress(() -> String.format("depth %d clauses %d decisions %d conflicts %d",
                        depth, clauses, decisions, conflicts));
            }
            // Success: every clause has been satisfied along the current path.
            if (f.isEmpty()) return report(Optional.of(ImmutableMap.copyOf(valuation)));

            if (f.hasEmptyClause()) {
                ++conflicts;
                // Unwind to the most recent branch point whose negation has not been tried.
                Branch b;
                while ((b = stack.peek()) != null && b.negated) stack.pop();
                if (b == null) return report(Optional.empty());
                b.negated = true;
                log.trace("backtrack: %d", -b.literal);
                assign(valuation, -b.literal);
                f = b.formula.simplify(-b.literal);
                continue;
            }

            OptionalInt unit = f.firstUnitLiteral();
            if (unit.isPresent()) {
                final int l = unit.getAsInt();
                ++propagations;
                log.trace("unit: %d", l);
                assign(valuation, l);
                f = f.simplify(l);
                continue;
            }

            final int l = selector.select(f, valuation)
                    .orElseThrow(() -> new IllegalStateException("no branching literal offered for a nonempty formula"));
            if (!f.contains(l) && !f.contains(-l)) {
                throw new IllegalStateException("branching literal " + l + " does not occur in the formula");
            }
            ++decisions;
            log.trace("decide: %d", l);
            stack.push(new Branch(f, l));
            assign(valuation, l);
            f = f.simplify(l);
        }
    }

    private static void assign(Map<Integer, Boolean> valuation, int literal) {
        valuation.put(Math.abs(literal), literal > 0);
    }
}
