package net.littleredcomputer.dpll;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The built-in branching policies.
 */
public enum Heuristic implements LiteralSelector {
    /**
     * Branch on the first variable, in the order the valuation was built, that has not been
     * decided on the current path. Decided variables have been simplified out of the formula,
     * so these are exactly the variables the formula still mentions.
     */
    FIXED_ORDER {
        @Override
        public OptionalInt select(Formula formula, Map<Integer, Boolean> valuation) {
            Set<Integer> live = formula.variables();
            for (int v : valuation.keySet()) {
                if (live.contains(v)) return OptionalInt.of(v);
            }
            return OptionalInt.empty();
        }
    },
    /**
     * Branch on the signed literal occurring most often in the formula. Ties go to the literal
     * encountered first. This is MOM's heuristic without the restriction to minimum-size clauses.
     */
    MAX_OCCURRENCE {
        @Override
        public OptionalInt select(Formula formula, Map<Integer, Boolean> valuation) {
            TIntIntHashMap count = new TIntIntHashMap();
            TIntArrayList order = new TIntArrayList();
            for (List<Integer> clause : formula.clauses()) {
                for (int l : clause) {
                    if (count.adjustOrPutValue(l, 1, 1) == 1) order.add(l);
                }
            }
            int best = 0;
            int bestCount = 0;
            for (int i = 0; i < order.size(); ++i) {
                int l = order.get(i);
                if (count.get(l) > bestCount) {
                    bestCount = count.get(l);
                    best = l;
                }
            }
            return best == 0 ? OptionalInt.empty() : OptionalInt.of(best);
        }
    };

    public static Heuristic fromName(String name) {
        switch (name) {
            case "fixed": return FIXED_ORDER;
            case "occurrence":
            case "mom": return MAX_OCCURRENCE;
            default: throw new IllegalArgumentException("Unknown heuristic: " + name);
        }
    }
}
