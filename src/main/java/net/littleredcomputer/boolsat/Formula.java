package net.littleredcomputer.boolsat;

/**
 * Anything that may appear as an operand of a Boolean expression: either a
 * {@link Variable} or a {@link BooleanExpr}. Instances are immutable.
 */
public abstract class Formula {
    // Only Variable and BooleanExpr may extend this.
    Formula() {}
}
