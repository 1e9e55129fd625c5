package net.littleredcomputer.boolsat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * An interior node of an expression tree. Exactly three kinds exist: {@link And}, {@link Or}
 * and {@link Not}. Nodes are built bottom-up by {@link Expressions} and never change afterwards,
 * so a tree can't contain a cycle.
 */
public abstract class BooleanExpr extends Formula {
    private static final Joiner commaJoiner = Joiner.on(", ");

    // Package-private so the three node kinds below are the only ones.
    BooleanExpr() {}

    /**
     * True iff every operand is true. An empty conjunction is true.
     */
    public static final class And extends BooleanExpr {
        private final ImmutableList<Formula> operands;

        And(Iterable<? extends Formula> operands) {
            this.operands = ImmutableList.copyOf(operands);
        }

        public ImmutableList<Formula> operands() { return operands; }

        @Override
        public boolean equals(Object o) {
            return o instanceof And && ((And) o).operands.equals(operands);
        }

        @Override
        public int hashCode() { return Objects.hash("and", operands); }

        @Override
        public String toString() { return "and(" + commaJoiner.join(operands) + ")"; }
    }

    /**
     * True iff at least one operand is true. An empty disjunction is false.
     */
    public static final class Or extends BooleanExpr {
        private final ImmutableList<Formula> operands;

        Or(Iterable<? extends Formula> operands) {
            this.operands = ImmutableList.copyOf(operands);
        }

        public ImmutableList<Formula> operands() { return operands; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Or && ((Or) o).operands.equals(operands);
        }

        @Override
        public int hashCode() { return Objects.hash("or", operands); }

        @Override
        public String toString() { return "or(" + commaJoiner.join(operands) + ")"; }
    }

    /**
     * True iff the operand is false.
     */
    public static final class Not extends BooleanExpr {
        private final Formula operand;

        Not(Formula operand) {
            this.operand = Objects.requireNonNull(operand, "operand");
        }

        public Formula operand() { return operand; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && ((Not) o).operand.equals(operand);
        }

        @Override
        public int hashCode() { return Objects.hash("not", operand); }

        @Override
        public String toString() { return "not(" + operand + ")"; }
    }
}
