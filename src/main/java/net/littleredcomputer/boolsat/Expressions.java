package net.littleredcomputer.boolsat;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;

/**
 * Constructors for Boolean expressions. {@link #implies} and {@link #xor} are rewrites into
 * and/or/not and introduce no node kinds of their own.
 */
public final class Expressions {
    private Expressions() {}

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public static ImmutableList<Variable> variables(String... names) {
        return Arrays.stream(names).map(Variable::new).collect(ImmutableList.toImmutableList());
    }

    // All variables or subexpressions must be true.
    public static BooleanExpr and(Formula... operands) {
        return new BooleanExpr.And(Arrays.asList(operands));
    }

    // At least one variable or subexpression must be true.
    public static BooleanExpr or(Formula... operands) {
        return new BooleanExpr.Or(Arrays.asList(operands));
    }

    public static BooleanExpr not(Formula operand) {
        return new BooleanExpr.Not(operand);
    }

    /**
     * If {@code a} is true then {@code b} must be true as well; if {@code a} is false, {@code b}
     * may be anything.
     */
    public static BooleanExpr implies(Formula a, Formula b) {
        return or(not(a), b);
    }

    /**
     * Exactly one of {@code a} and {@code b} is true. Both operands appear twice in the result,
     * so nesting xor doubles the size of the expression at each level.
     */
    public static BooleanExpr xor(Formula a, Formula b) {
        return or(and(a, not(b)), and(not(a), b));
    }
}
