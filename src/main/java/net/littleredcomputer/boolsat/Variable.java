package net.littleredcomputer.boolsat;

import com.google.common.base.Preconditions;

/**
 * A named propositional variable. Two variables are the same variable iff their names are equal.
 */
public final class Variable extends Formula implements Comparable<Variable> {
    private final String name;

    Variable(String name) {
        this.name = Preconditions.checkNotNull(name, "variable name");
    }

    public String name() { return name; }

    @Override
    public boolean equals(Object o) {
        return o instanceof Variable && ((Variable) o).name.equals(name);
    }

    @Override
    public int hashCode() { return name.hashCode(); }

    @Override
    public int compareTo(Variable o) { return name.compareTo(o.name); }

    @Override
    public String toString() { return name; }
}
