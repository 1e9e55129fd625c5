package net.littleredcomputer.boolsat;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * One-call entry points to the two solvers.
 */
public final class Solvers {
    private Solvers() {}

    // Generate all solutions that satisfy expr, in enumeration order.
    public static ImmutableList<Assignment> bruteForceAllSolutions(BooleanExpr expr) {
        return new BruteForceEnumerator(expr).allSolutions();
    }

    // Find one solution that satisfies expr.
    public static Optional<Assignment> getSolution(BooleanExpr expr) {
        return getSolution(expr, Assignment.empty(), VariableSelectors.firstUnset());
    }

    public static Optional<Assignment> getSolution(BooleanExpr expr, Assignment initialAssignments) {
        return getSolution(expr, initialAssignments, VariableSelectors.firstUnset());
    }

    public static Optional<Assignment> getSolution(BooleanExpr expr, Assignment initialAssignments, VariableSelector selectNextVar) {
        return new BacktrackingSolver(expr, selectNextVar).solve(initialAssignments);
    }

    /**
     * @return every variable of expr, in extraction order, bound to UNSET
     */
    public static Assignment getInitialAssignments(BooleanExpr expr) {
        return Assignment.unset(VariableExtractor.extract(expr));
    }
}
