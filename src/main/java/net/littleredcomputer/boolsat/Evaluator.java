package net.littleredcomputer.boolsat;

/**
 * Computes the truth value of a formula under an assignment.
 */
public final class Evaluator {
    private Evaluator() {}

    /**
     * @param f formula to evaluate
     * @param assignment must bind every variable of f to TRUE or FALSE
     * @return the truth value of f under the assignment
     * @throws IllegalStateException if a variable of f is unset, or f contains a node that
     *                               is none of and/or/not
     */
    public static boolean evaluate(Formula f, Assignment assignment) {
        if (f instanceof Variable) {
            Value v = assignment.get((Variable) f);
            if (!v.isSet()) throw new IllegalStateException("cannot evaluate unset variable " + f);
            return v == Value.TRUE;
        }
        if (f instanceof BooleanExpr.And) {
            for (Formula g : ((BooleanExpr.And) f).operands()) {
                if (!evaluate(g, assignment)) return false;
            }
            return true;
        }
        if (f instanceof BooleanExpr.Or) {
            for (Formula g : ((BooleanExpr.Or) f).operands()) {
                if (evaluate(g, assignment)) return true;
            }
            return false;
        }
        if (f instanceof BooleanExpr.Not) {
            return !evaluate(((BooleanExpr.Not) f).operand(), assignment);
        }
        throw new IllegalStateException("Invalid BooleanExpr: " + f);
    }
}
