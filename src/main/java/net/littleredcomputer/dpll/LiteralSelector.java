package net.littleredcomputer.dpll;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Chooses the literal on which the search branches when no unit clause is available.
 */
@FunctionalInterface
public interface LiteralSelector {
    /**
     * @param formula   the current (simplified) formula; it has no empty clause and no unit clause
     * @param valuation the valuation under construction, in the formula's original variable order
     * @return a literal occurring in the formula, or empty if there is none
     */
    OptionalInt select(Formula formula, Map<Integer, Boolean> valuation);
}
