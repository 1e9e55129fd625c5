package net.littleredcomputer.boolsat;

import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the distinct variables of a formula in the order in which a pre-order, left-to-right
 * walk first meets them. That order fixes the default branching order of
 * {@link BacktrackingSolver} and the bit positions used by {@link BruteForceEnumerator}.
 */
public final class VariableExtractor {
    private VariableExtractor() {}

    public static ImmutableSet<Variable> extract(Formula f) {
        Set<Variable> variables = new LinkedHashSet<>();
        collect(f, variables);
        return ImmutableSet.copyOf(variables);
    }

    private static void collect(Formula f, Set<Variable> variables) {
        if (f instanceof Variable) {
            variables.add((Variable) f);
        } else if (f instanceof BooleanExpr.And) {
            for (Formula g : ((BooleanExpr.And) f).operands()) collect(g, variables);
        } else if (f instanceof BooleanExpr.Or) {
            for (Formula g : ((BooleanExpr.Or) f).operands()) collect(g, variables);
        } else if (f instanceof BooleanExpr.Not) {
            collect(((BooleanExpr.Not) f).operand(), variables);
        } else {
            throw new IllegalStateException("Invalid BooleanExpr: " + f);
        }
    }
}
