package net.littleredcomputer.boolsat;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stock branching policies.
 */
public final class VariableSelectors {
    private VariableSelectors() {}

    private static final VariableSelector FIRST_UNSET = firstUnset(false);

    /**
     * The default policy: the first unset variable in extraction order, trying false first.
     */
    public static VariableSelector firstUnset() { return FIRST_UNSET; }

    public static VariableSelector firstUnset(boolean preferTrue) {
        return (variables, assignment) -> variables.stream()
                .filter(v -> !assignment.get(v).isSet())
                .findFirst()
                .map(v -> Choice.of(v, preferTrue));
    }

    /**
     * A policy that analyzes {@code expr} once and then branches on the unset variable with the
     * most occurrences in it (ties go to the earlier variable in extraction order), trying first
     * the value that makes the majority of those occurrences true. An occurrence is negative when
     * it sits under an odd number of nots.
     */
    public static VariableSelector byOccurrence(BooleanExpr expr) {
        return new OccurrenceSelector(expr);
    }

    /**
     * Wrap {@code selector} so that a search running longer than {@code budget}, measured from the
     * first call, is abandoned with a {@link SearchTimeoutException}. The returned selector is
     * good for a single search.
     */
    public static VariableSelector withDeadline(VariableSelector selector, Duration budget) {
        if (budget.isNegative()) throw new IllegalArgumentException("negative budget: " + budget);
        final Stopwatch stopwatch = Stopwatch.createUnstarted();
        return (variables, assignment) -> {
            if (!stopwatch.isRunning()) stopwatch.start();
            Duration elapsed = stopwatch.elapsed();
            if (elapsed.compareTo(budget) > 0) throw new SearchTimeoutException(budget, elapsed);
            return selector.select(variables, assignment);
        };
    }

    private static class OccurrenceSelector implements VariableSelector {
        private final TObjectIntHashMap<Variable> positive = new TObjectIntHashMap<>();
        private final TObjectIntHashMap<Variable> negative = new TObjectIntHashMap<>();
        private final ImmutableList<Variable> ranked;

        OccurrenceSelector(BooleanExpr expr) {
            count(expr, false);
            Comparator<Variable> byCount = Comparator.comparingInt(v -> positive.get(v) + negative.get(v));
            // The sort is stable, so equal counts keep extraction order.
            ranked = ImmutableList.sortedCopyOf(byCount.reversed(), VariableExtractor.extract(expr));
        }

        private void count(Formula f, boolean negated) {
            if (f instanceof Variable) {
                (negated ? negative : positive).adjustOrPutValue((Variable) f, 1, 1);
            } else if (f instanceof BooleanExpr.And) {
                for (Formula g : ((BooleanExpr.And) f).operands()) count(g, negated);
            } else if (f instanceof BooleanExpr.Or) {
                for (Formula g : ((BooleanExpr.Or) f).operands()) count(g, negated);
            } else if (f instanceof BooleanExpr.Not) {
                count(((BooleanExpr.Not) f).operand(), !negated);
            } else {
                throw new IllegalStateException("Invalid BooleanExpr: " + f);
            }
        }

        @Override
        public Optional<Choice> select(List<Variable> variables, Assignment assignment) {
            for (Variable v : ranked) {
                if (!assignment.get(v).isSet()) return Optional.of(Choice.of(v, positive.get(v) >= negative.get(v)));
            }
            // Variables the analysis never saw, if the caller's list has any.
            return FIRST_UNSET.select(variables, assignment);
        }
    }
}
