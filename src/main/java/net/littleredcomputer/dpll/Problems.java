package net.littleredcomputer.dpll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Generators for some classical families of satisfiability problems, handy as benchmarks
 * and as test cases whose answers are known in advance.
 */
public final class Problems {
    private Problems() {}

    /**
     * The problem waerden(j, k; n): a binary string of length n with no j equally-spaced 0s
     * and no k equally-spaced 1s. Variable i is the ith bit. Satisfiable iff n &lt; W(j, k).
     *
     * @param j Number of equally-spaced 0s to forbid
     * @param k Number of equally-spaced 1s to forbid
     * @param n Length of binary string
     */
    public static Formula waerden(int j, int k, int n) {
        if (j < 1 || k < 1 || n < 1) throw new IllegalArgumentException("waerden parameters must be positive");
        List<List<Integer>> clauses = new ArrayList<>();
        progressions(j, n, 1, clauses);
        progressions(k, n, -1, clauses);
        return Formula.of(clauses);
    }

    private static void progressions(int length, int n, int sign, List<List<Integer>> clauses) {
        boolean addedSome = true;
        for (int d = 1; addedSome; ++d) {
            addedSome = false;
            for (int i = 1; i + (length - 1) * d <= n; ++i) {
                List<Integer> clause = new ArrayList<>(length);
                for (int h = 0; h < length; ++h) clause.add(sign * (i + d * h));
                clauses.add(clause);
                addedSome = true;
            }
            // A one-term progression has no spacing, so every d gives the same clauses.
            if (length == 1) break;
        }
    }

    /**
     * Langford pairs: arrange two copies of each of 1..n so that the copies of i are i positions
     * apart. Each variable is one placement of one digit; every digit and every position must be
     * covered exactly once. Satisfiable iff n mod 4 is 0 or 3, in which case exactly n variables
     * are true.
     */
    public static Formula langford(int n) {
        if (n < 1) throw new IllegalArgumentException("n must be positive");
        // One column per digit, then one per position; each placement (variable) covers three columns.
        List<List<Integer>> columns = new ArrayList<>(3 * n);
        for (int i = 0; i < 3 * n; ++i) columns.add(new ArrayList<>());
        int variable = 0;
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j + i + 2 < 2 * n; ++j) {
                ++variable;
                columns.get(i).add(variable);
                columns.get(n + j).add(variable);
                columns.get(n + j + i + 2).add(variable);
            }
        }
        List<List<Integer>> clauses = new ArrayList<>();
        for (List<Integer> c : columns) exactlyOne(c, clauses);
        return Formula.of(clauses);
    }

    /**
     * n + 1 pigeons, n holes, at most one pigeon per hole. Always unsatisfiable.
     * Variable i*n + j + 1 places pigeon i in hole j.
     */
    public static Formula pigeonhole(int n) {
        if (n < 1) throw new IllegalArgumentException("n must be positive");
        List<List<Integer>> clauses = new ArrayList<>();
        for (int i = 0; i <= n; ++i) {
            List<Integer> somewhere = new ArrayList<>(n);
            for (int j = 0; j < n; ++j) somewhere.add(i * n + j + 1);
            clauses.add(somewhere);
        }
        for (int j = 0; j < n; ++j) {
            for (int i = 0; i <= n; ++i) {
                for (int k = i + 1; k <= n; ++k) {
                    clauses.add(List.of(-(i * n + j + 1), -(k * n + j + 1)));
                }
            }
        }
        return Formula.of(clauses);
    }

    /**
     * A random instance: m clauses, each of k distinct variables drawn from 1..n with random signs.
     * The same arguments always give the same formula.
     */
    public static Formula randomInstance(int k, int m, int n, long seed) {
        if (k <= 0) throw new IllegalArgumentException("k must be positive!");
        if (m <= 0) throw new IllegalArgumentException("m must be positive!");
        if (n <= 0) throw new IllegalArgumentException("n must be positive!");
        if (k > n) throw new IllegalArgumentException("k mustn't exceed n!");
        final Random r = new Random(seed);
        List<Integer> vars = new ArrayList<>(n);
        for (int v = 1; v <= n; ++v) vars.add(v);
        List<List<Integer>> clauses = new ArrayList<>(m);
        for (int c = 0; c < m; ++c) {
            Collections.shuffle(vars, r);
            List<Integer> clause = new ArrayList<>(k);
            for (int i = 0; i < k; ++i) clause.add(r.nextBoolean() ? vars.get(i) : -vars.get(i));
            clauses.add(clause);
        }
        return Formula.of(clauses);
    }

    /** Require exactly one of the given variables: one clause asking for some, and one per pair forbidding both. */
    private static void exactlyOne(List<Integer> vars, List<List<Integer>> clauses) {
        clauses.add(new ArrayList<>(vars));
        for (int i = 0; i < vars.size(); ++i) {
            for (int j = i + 1; j < vars.size(); ++j) {
                clauses.add(List.of(-vars.get(i), -vars.get(j)));
            }
        }
    }
}
