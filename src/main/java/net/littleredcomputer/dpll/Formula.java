package net.littleredcomputer.dpll;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.CheckReturnValue;
import java.io.BufferedReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * An immutable formula in conjunctive normal form. Literals are nonzero signed
 * integers: the magnitude is the variable number and the sign its polarity.
 */
public final class Formula {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();
    private static final Formula EMPTY = new Formula(ImmutableList.of());

    private final ImmutableList<ImmutableList<Integer>> clauses;
    private final int nLiterals;
    private final int width;

    private Formula(ImmutableList<ImmutableList<Integer>> clauses) {
        this.clauses = clauses;
        int n = 0, w = 0;
        for (List<Integer> c : clauses) {
            n += c.size();
            if (c.size() > w) w = c.size();
        }
        nLiterals = n;
        width = w;
    }

    public static Formula empty() { return EMPTY; }

    public static Formula of(Iterable<? extends Iterable<Integer>> clauses) {
        ImmutableList.Builder<ImmutableList<Integer>> b = ImmutableList.builder();
        for (Iterable<Integer> c : clauses) {
            ImmutableList<Integer> clause = ImmutableList.copyOf(c);
            for (int l : clause) {
                if (l == 0) throw new IllegalArgumentException("0 is not a literal");
            }
            b.add(clause);
        }
        return new Formula(b.build());
    }

    public static Formula of(int[]... clauses) {
        return of(Arrays.stream(clauses)
                .map(c -> Arrays.stream(c).boxed().collect(Collectors.toList()))
                .collect(Collectors.toList()));
    }

    public int nClauses() { return clauses.size(); }
    public int nLiterals() { return nLiterals; }
    public int width() { return width; }
    public List<Integer> getClause(int i) { return clauses.get(i); }
    public List<List<Integer>> clauses() { return Collections.unmodifiableList(clauses); }

    /** @return true if there are no clauses left, i.e., the formula is trivially true */
    public boolean isEmpty() { return clauses.isEmpty(); }

    /** @return true if some clause has no literals, i.e., the formula is trivially false */
    public boolean hasEmptyClause() {
        for (List<Integer> c : clauses) {
            if (c.isEmpty()) return true;
        }
        return false;
    }

    public boolean hasUnitClause() { return firstUnitLiteral().isPresent(); }

    /**
     * @return the literal of the first clause (in clause order) having exactly one literal,
     * or empty if there is no such clause
     */
    public OptionalInt firstUnitLiteral() {
        for (List<Integer> c : clauses) {
            if (c.size() == 1) return OptionalInt.of(c.get(0));
        }
        return OptionalInt.empty();
    }

    public boolean contains(int literal) {
        for (List<Integer> c : clauses) {
            if (c.contains(literal)) return true;
        }
        return false;
    }

    /**
     * Every variable mentioned in the formula, in order of first occurrence, regardless of the
     * polarities in which it appears.
     */
    public ImmutableSet<Integer> variables() {
        ImmutableSet.Builder<Integer> b = ImmutableSet.builder();
        for (List<Integer> c : clauses) {
            for (int l : c) b.add(Math.abs(l));
        }
        return b.build();
    }

    /**
     * Assume the given literal true. Clauses containing it are satisfied and vanish; clauses containing
     * its negation lose every occurrence of the negation. The order of surviving clauses, and of the
     * literals within them, is preserved.
     *
     * @param literal assumed true
     * @return the simplified formula (this formula is unchanged)
     */
    @CheckReturnValue
    public Formula simplify(int literal) {
        if (literal == 0) throw new IllegalArgumentException("0 is not a literal");
        final int negation = -literal;
        ImmutableList.Builder<ImmutableList<Integer>> b = ImmutableList.builder();
        for (ImmutableList<Integer> c : clauses) {
            if (c.contains(literal)) continue;
            if (c.contains(negation)) {
                ImmutableList.Builder<Integer> cb = ImmutableList.builder();
                for (int l : c) if (l != negation) cb.add(l);
                b.add(cb.build());
            } else {
                b.add(c);
            }
        }
        return new Formula(b.build());
    }

    /**
     * Evaluate the formula under a valuation. Variables missing from the valuation count as false.
     *
     * @param valuation variable number to truth value
     * @return true if every clause contains a literal made true by the valuation
     */
    public boolean evaluate(Map<Integer, Boolean> valuation) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (valuation.getOrDefault(Math.abs(literal), false) == (literal > 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    public static Formula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Read a formula in DIMACS CNF format.
     */
    public static Formula parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        List<List<Integer>> clauses = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines().filter(s -> !s.startsWith("c")).iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        ls.forEachRemaining(line -> StreamSupport.stream(splitter.split(line).spliterator(), false)
                .mapToInt(Formula::parseLiteral)
                .forEach(l -> {
                    if (l == 0) {
                        if (literals.isEmpty())
                            throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
                        clauses.add(new ArrayList<>(literals));
                        literals.clear();
                    } else {
                        if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds: " + l);
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (clauses.size() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return of(clauses);
    }

    public static Formula parseLines(String s) { return parseLines(new StringReader(s)); }

    /**
     * Read a formula written one clause per line, each clause terminated by 0. The first line is a
     * preamble and is skipped. Blank lines are ignored.
     */
    public static Formula parseLines(Reader r) {
        List<List<Integer>> clauses = new BufferedReader(r).lines()
                .skip(1)
                .filter(line -> !CharMatcher.whitespace().trimFrom(line).isEmpty())
                .map(line -> {
                    List<Integer> tokens = StreamSupport.stream(splitter.split(line).spliterator(), false)
                            .map(Formula::parseLiteral)
                            .collect(Collectors.toList());
                    int last = tokens.size() - 1;
                    if (tokens.get(last) != 0) throw new IllegalArgumentException("clause not terminated by 0: " + line);
                    List<Integer> clause = tokens.subList(0, last);
                    if (clause.contains(0)) throw new IllegalArgumentException("0 inside clause: " + line);
                    return clause;
                })
                .collect(Collectors.toList());
        return of(clauses);
    }

    private static int parseLiteral(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a literal: " + token, e);
        }
    }

    public void toDimacs(PrintStream p, String title) {
        int nVar = variables().stream().mapToInt(Integer::intValue).max().orElse(0);
        p.println("c " + title);
        p.printf("p cnf %d %d\n", nVar, nClauses());
        for (List<Integer> c : clauses) {
            for (int l : c) p.printf("%d ", l);
            p.println("0");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        return clauses.equals(((Formula) o).clauses);
    }

    @Override
    public int hashCode() { return clauses.hashCode(); }

    @Override
    public String toString() { return clauses.toString(); }
}
