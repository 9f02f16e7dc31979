package net.littleredcomputer.satornot;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class ClauseTest {
    private final Clause c = Clause.of(1, -2, 3);

    @Test
    public void satisfiedNeedsATrueLiteral() {
        Assignment a = new Assignment(3);
        assertThat(c.isSatisfiedBy(a), is(false));
        a.set(2, true);
        assertThat(c.isSatisfiedBy(a), is(false));
        a.set(3, true);
        assertThat(c.isSatisfiedBy(a), is(true));
    }

    @Test
    public void falsifiedNeedsEveryLiteralFalse() {
        Assignment a = new Assignment(3);
        a.set(1, false);
        a.set(2, true);
        // Variable 3 is still open: neither satisfied nor falsified.
        assertThat(c.isFalsifiedBy(a), is(false));
        assertThat(c.isSatisfiedBy(a), is(false));
        a.set(3, false);
        assertThat(c.isFalsifiedBy(a), is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroLiteral() {
        Clause.of(1, 0, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalWithoutNegation() {
        Clause.of(1, Integer.MIN_VALUE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty() {
        Clause.of();
    }

    @Test
    public void orderMatters() {
        assertThat(Clause.of(1, 2, 3), is(Clause.of(1, 2, 3)));
        assertThat(Clause.of(2, 1, 3), is(not(Clause.of(1, 2, 3))));
        assertThat(Clause.of(1, 2, -3), is(not(Clause.of(1, 2, 3))));
    }

    @Test
    public void encodeAndParse() {
        assertThat(c.encode(), is("1.-2.3"));
        assertThat(Clause.parse("1.-2.3"), is(c));
        assertThat(Clause.parse("-4").literals(), contains(-4));
        assertThat(c.maxVariable(), is(3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseRejectsGarbage() {
        Clause.parse("1.x.3");
    }
}
