package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class FormulaTest {

    @Test
    public void simple() {
        Formula f = Formula.parseFrom(new StringReader("c simple test\nc heh\np cnf 3 2\n1 -3 0\n2 3 -1 0"));
        assertThat(f.nClauses(), is(2));
        assertThat(f.nLiterals(), is(5));
        assertThat(f.width(), is(3));
        assertThat(f.getClause(1), contains(2, 3, -1));
    }

    @Test
    public void clausesMaySpanLines() {
        Formula f = Formula.parseFrom("p cnf 3 2\n1\n-3 0 2\t3\n-1 0\n");
        assertThat(f, is(Formula.of(new int[]{1, -3}, new int[]{2, 3, -1})));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyClauseThrows() {
        Formula.parseFrom(new StringReader("c empty clause\np cnf 3 3\n1 2 3 0 0 1 2 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalOutOfBounds() {
        Formula.parseFrom(new StringReader("c oob literal\np cnf 3 2\n1 2 3 0\n2 3 4 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyClauses() {
        Formula.parseFrom(new StringReader("c oob clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void danglingClause() {
        Formula.parseFrom(new StringReader("c unclosed clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingPLine() {
        Formula.parseFrom("c nothing here\n1 2 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void notAnInteger() {
        Formula.parseFrom("p cnf 2 1\n1 x 0\n");
    }

    @Test
    public void linesSkipsPreambleAndStripsSentinel() {
        Formula f = Formula.parseLines("p cnf 4 3\n1 2 0\n-1 3 0\n\n4 0\n");
        assertThat(f, is(Formula.of(new int[]{1, 2}, new int[]{-1, 3}, new int[]{4})));
    }

    @Test
    public void linesIgnoresUnicodeBlankLines() {
        Formula f = Formula.parseLines("preamble\n1 2 0\n\u00A0\u2003\n-1 0\n");
        assertThat(f, is(Formula.of(new int[]{1, 2}, new int[]{-1})));
    }

    @Test(expected = IllegalArgumentException.class)
    public void linesMissingSentinel() {
        Formula.parseLines("preamble\n1 2\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void linesZeroInsideClause() {
        Formula.parseLines("preamble\n1 0 2 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroIsNotALiteral() {
        Formula.of(new int[]{1, 0});
    }

    @Test
    public void emptyAndEmptyClause() {
        assertThat(Formula.empty().isEmpty(), is(true));
        assertThat(Formula.empty().hasEmptyClause(), is(false));
        Formula f = Formula.of(new int[]{1}, new int[]{});
        assertThat(f.isEmpty(), is(false));
        assertThat(f.hasEmptyClause(), is(true));
    }

    @Test
    public void firstUnitClauseInOrder() {
        Formula f = Formula.of(new int[]{1, 2}, new int[]{-3}, new int[]{4}, new int[]{});
        assertThat(f.hasUnitClause(), is(true));
        assertThat(f.firstUnitLiteral(), is(OptionalInt.of(-3)));
        assertThat(Formula.of(new int[]{1, 2}, new int[]{}).firstUnitLiteral(), is(OptionalInt.empty()));
    }

    @Test
    public void variablesInOrderOfFirstOccurrence() {
        Formula f = Formula.of(new int[]{-4, 2}, new int[]{2, -2, 7}, new int[]{4, 1});
        assertThat(f.variables(), contains(4, 2, 7, 1));
        assertThat(Formula.empty().variables(), is(empty()));
    }

    @Test
    public void simplify() {
        Formula f = Formula.of(new int[]{1, 2}, new int[]{3, -1, 4}, new int[]{2, 3}, new int[]{-1});
        Formula g = f.simplify(1);
        assertThat(g, is(Formula.of(new int[]{3, 4}, new int[]{2, 3}, new int[]{})));
        assertThat(g.contains(1), is(false));
        // the original is untouched
        assertThat(f.nClauses(), is(4));
        assertThat(f.getClause(1), contains(3, -1, 4));
    }

    @Test
    public void simplifyNegativeLiteral() {
        Formula f = Formula.of(new int[]{1, 2}, new int[]{-2, 3}, new int[]{2});
        assertThat(f.simplify(-2), is(Formula.of(new int[]{1}, new int[]{})));
    }

    @Test
    public void simplifyRemovesRepeatedNegations() {
        Formula f = Formula.of(new int[]{-1, 2, -1}, new int[]{1, 1}, new int[]{-1, -1});
        assertThat(f.simplify(1), is(Formula.of(new int[]{2}, new int[]{})));
    }

    @Test
    public void evaluate() {
        Formula f = Formula.of(new int[]{1, -2}, new int[]{2, 3});
        assertThat(f.evaluate(ImmutableMap.of(1, true, 2, true, 3, false)), is(true));
        assertThat(f.evaluate(ImmutableMap.of(1, false, 2, true, 3, true)), is(false));
        // missing variables read as false
        assertThat(f.evaluate(ImmutableMap.of(3, true)), is(true));
        assertThat(Formula.empty().evaluate(ImmutableMap.of()), is(true));
        assertThat(Formula.of(new int[]{}).evaluate(ImmutableMap.of()), is(false));
    }

    @Test
    public void dimacsRoundTrip() {
        Formula f = Formula.of(new int[]{1, -3}, new int[]{2, 3, -1});
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        f.toDimacs(new PrintStream(bytes, true), "test");
        String s = bytes.toString(StandardCharsets.UTF_8);
        assertThat(s, is("c test\np cnf 3 2\n1 -3 0\n2 3 -1 0\n"));
        assertThat(Formula.parseFrom(s), is(f));
    }
}
