package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tries every assignment of the formula's variables, counting in binary with the first
 * variable as the low-order bit. Only suitable for small formulas, where it serves as an
 * independent check on the other solvers.
 */
public class ExhaustiveSolver extends AbstractSATSolver {
    static final int MAX_VARIABLES = 24;

    public ExhaustiveSolver(Formula formula) {
        super("exhaustive", formula);
        if (formula.variables().size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("too many variables for exhaustive search: " + formula.variables().size());
        }
    }

    @Override
    public Optional<Map<Integer, Boolean>> solve() {
        start();
        final ImmutableList<Integer> vars = formula.variables().asList();
        final int n = vars.size();
        final Map<Integer, Boolean> valuation = new LinkedHashMap<>();
        for (long bits = 0; bits < 1L << n; ++bits) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) {
                final long b = bits;
                maybeReportProgress(() -> Long.toBinaryString(b));
            }
            for (int i = 0; i < n; ++i) valuation.put(vars.get(i), ((bits >> i) & 1) == 1);
            if (formula.evaluate(valuation)) return report(Optional.of(ImmutableMap.copyOf(valuation)));
        }
        return report(Optional.empty());
    }
}
