package net.littleredcomputer.boolsat;

import java.util.Objects;

/**
 * A branching decision returned by a {@link VariableSelector}: the variable to decide next and
 * the truth value to try first.
 */
public final class Choice {
    private final Variable variable;
    private final boolean preferTrue;

    private Choice(Variable variable, boolean preferTrue) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.preferTrue = preferTrue;
    }

    public static Choice of(Variable variable, boolean preferTrue) {
        return new Choice(variable, preferTrue);
    }

    public Variable variable() { return variable; }

    public boolean preferTrue() { return preferTrue; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Choice)) return false;
        Choice c = (Choice) o;
        return c.variable.equals(variable) && c.preferTrue == preferTrue;
    }

    @Override
    public int hashCode() { return Objects.hash(variable, preferTrue); }

    @Override
    public String toString() { return variable + "=" + preferTrue + "?"; }
}
