package net.littleredcomputer.boolsat;

import org.junit.Test;

import static net.littleredcomputer.boolsat.Expressions.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class ExpressionsTest {
    private final Variable a = variable("a");
    private final Variable b = variable("b");
    private static final boolean[] bools = new boolean[]{false, true};

    private boolean eval(BooleanExpr e, boolean x, boolean y) {
        return Evaluator.evaluate(e, Assignment.empty().with(a, x).with(b, y));
    }

    @Test
    public void impliesIsNotAOrB() {
        assertThat(implies(a, b), is(or(not(a), b)));
        for (boolean x : bools) for (boolean y : bools) assertThat(eval(implies(a, b), x, y), is(!x || y));
    }

    @Test
    public void xorIsTrueForExactlyOne() {
        assertThat(xor(a, b), is(or(and(a, not(b)), and(not(a), b))));
        for (boolean x : bools) for (boolean y : bools) assertThat(eval(xor(a, b), x, y), is(x ^ y));
    }

    @Test
    public void emptyOperandsAreVacuous() {
        assertThat(Evaluator.evaluate(and(), Assignment.empty()), is(true));
        assertThat(Evaluator.evaluate(or(), Assignment.empty()), is(false));
        assertThat(((BooleanExpr.And) and()).operands(), is(empty()));
    }

    @Test
    public void operandsKeepTheirOrder() {
        assertThat(((BooleanExpr.Or) or(b, a, not(b))).operands(), contains(b, a, not(b)));
    }

    @Test
    public void nestedXorDoublesInSize() {
        BooleanExpr x = xor(xor(a, b), variable("c"));
        assertThat(x.toString(), is("or(and(or(and(a, not(b)), and(not(a), b)), not(c)), and(not(or(and(a, not(b)), and(not(a), b))), c))"));
    }

    @Test
    public void structuralEquality() {
        assertThat(and(a, not(b)).equals(and(variable("a"), not(variable("b")))), is(true));
        assertThat(and(a, b).equals(or(a, b)), is(false));
        assertThat(and(a, b).equals(and(b, a)), is(false));
        assertThat(and(a, not(b)).hashCode(), is(and(variable("a"), not(variable("b"))).hashCode()));
    }

    @Test
    public void rendering() {
        assertThat(implies(a, and(b, variable("c"))).toString(), is("or(not(a), and(b, c))"));
        assertThat(and().toString(), is("and()"));
    }

    @Test(expected = NullPointerException.class)
    public void nullOperandRejected() {
        and(a, null);
    }

    @Test(expected = NullPointerException.class)
    public void nullVariableNameRejected() {
        variable(null);
    }
}
