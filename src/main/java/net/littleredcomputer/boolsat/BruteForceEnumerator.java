package net.littleredcomputer.boolsat;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Finds every satisfying assignment of an expression by trying all 2^n assignments of its n
 * variables. Exponential in n; meant as a reference answer for small expressions.
 */
public class BruteForceEnumerator extends AbstractSolver {
    // The enumeration counter is a long.
    static final int MAX_VARIABLES = 62;

    public BruteForceEnumerator(BooleanExpr expr) {
        super("brute force", expr);
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("too many variables to enumerate: " + variables.size());
        }
    }

    /**
     * Every complete assignment of the given variables, in the order of the integers
     * 0 .. 2^n-1: variable i is true iff bit i of the n-bit numeral, counted from the most
     * significant end, is 1.
     */
    public static Stream<Assignment> allAssignments(List<Variable> variables) {
        final int n = variables.size();
        if (n > MAX_VARIABLES) throw new IllegalArgumentException("too many variables to enumerate: " + n);
        return LongStream.range(0, 1L << n).mapToObj(k -> {
            Assignment a = Assignment.empty();
            for (int i = 0; i < n; ++i) {
                a = a.with(variables.get(i), ((k >>> (n - 1 - i)) & 1) != 0);
            }
            return a;
        });
    }

    /**
     * The satisfying assignments, lazily, in enumeration order.
     */
    public Stream<Assignment> solutions() {
        return allAssignments(variables).filter(a -> {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(a);
            return Evaluator.evaluate(expr, a);
        });
    }

    public ImmutableList<Assignment> allSolutions() {
        start();
        ImmutableList<Assignment> s = solutions().collect(ImmutableList.toImmutableList());
        finish(!s.isEmpty());
        return s;
    }
}
