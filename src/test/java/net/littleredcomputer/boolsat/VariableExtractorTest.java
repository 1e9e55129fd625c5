package net.littleredcomputer.boolsat;

import org.junit.Test;

import static net.littleredcomputer.boolsat.Expressions.*;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class VariableExtractorTest {
    private final Variable a = variable("a");
    private final Variable b = variable("b");
    private final Variable c = variable("c");
    private final Variable d = variable("d");
    private final Variable e = variable("e");

    @Test
    public void firstOccurrenceOrder() {
        BooleanExpr expr = and(not(b), or(a, b), xor(b, c), implies(c, and(d, e)));
        assertThat(VariableExtractor.extract(expr), contains(b, a, c, d, e));
    }

    @Test
    public void preOrderLeftToRight() {
        assertThat(VariableExtractor.extract(or(and(not(c), a), b, not(not(d)), a)), contains(c, a, b, d));
    }

    @Test
    public void repeatsCountOnce() {
        assertThat(VariableExtractor.extract(and(a, a, not(a), or(a))), contains(a));
    }

    @Test
    public void bareVariable() {
        assertThat(VariableExtractor.extract(e), contains(e));
    }

    @Test
    public void noVariables() {
        assertThat(VariableExtractor.extract(and(or(), not(and()))), empty());
    }

    @Test(expected = IllegalStateException.class)
    public void malformedNode() {
        VariableExtractor.extract(and(a, new BooleanExpr() {}));
    }
}
