package net.littleredcomputer.boolsat;

import java.util.Optional;

/**
 * Finds one satisfying assignment by exhaustive binary backtracking. At each node the
 * {@link VariableSelector} picks an unset variable and the value to try first; the solver
 * recurses on that value and, if the subtree fails, on the opposite one. The expression is
 * evaluated only once every variable on the path is decided: there is no propagation, so the
 * selector is the only lever on the size of the search.
 * <p>
 * Each recursive call receives its own copy of the assignment, extended by one binding.
 * Instances keep per-search counters and are not thread safe.
 */
public class BacktrackingSolver extends AbstractSolver {
    private final VariableSelector selector;
    private long nodeCount;
    private long leafCount;

    public BacktrackingSolver(BooleanExpr expr) {
        this(expr, VariableSelectors.firstUnset());
    }

    public BacktrackingSolver(BooleanExpr expr, VariableSelector selector) {
        super("backtrack", expr);
        this.selector = selector;
    }

    public Optional<Assignment> solve() {
        return solve(Assignment.empty());
    }

    /**
     * @param initialAssignments bindings to impose before the search begins; variables not
     *                           mentioned start out UNSET. Bindings of variables that don't occur
     *                           in the expression are carried into the result unchanged.
     * @return a complete satisfying assignment extending the initial one, if there is one
     */
    public Optional<Assignment> solve(Assignment initialAssignments) {
        start();
        nodeCount = 0;
        leafCount = 0;
        Optional<Assignment> solution = search(Assignment.unset(variables).overriddenBy(initialAssignments));
        finish(solution.isPresent());
        return solution;
    }

    private Optional<Assignment> search(Assignment assignment) {
        ++nodeCount;
        ++stepCount;
        if (stepCount % logCheckSteps == 0) maybeReportProgress(assignment);

        Optional<Choice> next = selector.select(variables, assignment);
        if (!next.isPresent()) {
            ++leafCount;
            return Evaluator.evaluate(expr, assignment) ? Optional.of(assignment) : Optional.empty();
        }
        final Variable v = next.get().variable();
        final boolean first = next.get().preferTrue();
        if (assignment.get(v).isSet()) {
            throw new IllegalStateException("selector chose " + v + ", which is already " + assignment.get(v));
        }
        Optional<Assignment> s = search(assignment.with(v, first));
        if (s.isPresent()) return s;
        return search(assignment.with(v, !first));
    }

    /**
     * @return the number of search nodes visited by the most recent {@link #solve}
     */
    public long nodeCount() { return nodeCount; }

    /**
     * @return the number of complete assignments evaluated by the most recent {@link #solve}
     */
    public long leafCount() { return leafCount; }
}
