package net.littleredcomputer.satornot;

import com.google.common.collect.Lists;
import net.littleredcomputer.satornot.sat.BacktrackingSolver;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class AssignmentTest {

    @Test
    public void startsUnassigned() {
        Assignment a = new Assignment(3);
        assertThat(a.nVariables(), is(3));
        assertThat(a.firstUnassigned(), is(1));
        assertThat(a.isComplete(), is(false));
        assertThat(a.encode(), is("UUU"));
    }

    @Test
    public void evaluateLiterals() {
        Assignment a = new Assignment(3);
        a.set(1, true);
        a.set(2, false);
        assertThat(a.evaluate(1), is(Truth.TRUE));
        assertThat(a.evaluate(-1), is(Truth.FALSE));
        assertThat(a.evaluate(2), is(Truth.FALSE));
        assertThat(a.evaluate(-2), is(Truth.TRUE));
        assertThat(a.evaluate(3), is(Truth.UNASSIGNED));
        assertThat(a.evaluate(-3), is(Truth.UNASSIGNED));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroLiteral() {
        new Assignment(2).evaluate(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalBeyondAssignment() {
        new Assignment(2).evaluate(-3);
    }

    @Test
    public void firstUnassignedIsLowest() {
        Assignment a = new Assignment(4);
        a.set(1, false);
        a.set(3, true);
        assertThat(a.firstUnassigned(), is(2));
        a.set(2, true);
        assertThat(a.firstUnassigned(), is(4));
        a.set(4, true);
        assertThat(a.firstUnassigned(), is(0));
        assertThat(a.isComplete(), is(true));
        a.unassign(3);
        assertThat(a.firstUnassigned(), is(3));
    }

    @Test
    public void copyIsIndependent() {
        Assignment a = Assignment.of(true, false);
        Assignment b = a.copy();
        assertThat(b, is(a));
        b.unassign(1);
        assertThat(b, is(not(a)));
        assertThat(a.encode(), is("TF"));
    }

    @Test
    public void encodeAndParse() {
        Assignment a = new Assignment(5);
        a.set(2, true);
        a.set(3, false);
        assertThat(a.encode(), is("UTFUU"));
        // Trailing unassigned variables survive the trip.
        assertThat(Assignment.parse(a.encode()), is(a));
        assertThat(Assignment.parse(""), is(new Assignment(0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseRejectsUnknownCode() {
        Assignment.parse("TFX");
    }

    @Test
    public void everyShortEncodingSurvives() {
        // All strings over T, F, U of length 0 through 4.
        List<String> codes = Lists.newArrayList("");
        for (int length = 1; length <= 4; ++length) {
            List<String> longer = new ArrayList<>();
            for (String c : codes) if (c.length() == length - 1) for (char t : "TFU".toCharArray()) longer.add(c + t);
            codes.addAll(longer);
        }
        assertThat(codes.size(), is(1 + 3 + 9 + 27 + 81));
        for (String c : codes) {
            Assignment a = Assignment.parse(c);
            assertThat(a.nVariables(), is(c.length()));
            assertThat(a.encode(), is(c));
            assertThat(Assignment.parse(a.encode()), is(a));
        }
    }

    @Test
    public void witnessesSurviveEncoding() {
        InstanceGenerator g = new InstanceGenerator(new Random(31));
        for (int i = 0; i < 100; ++i) {
            Formula f = g.generate(6, 3, 12);
            new BacktrackingSolver(f).solve().ifPresent(w -> assertThat(Assignment.parse(w.encode()), is(w)));
        }
    }
}
