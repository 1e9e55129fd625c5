package net.littleredcomputer.boolsat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable binding of variables to {@link Value}s. Iteration follows insertion order.
 * Methods that "change" an assignment return a fresh copy, so branches of a search that start
 * from the same assignment never see each other's bindings.
 */
public final class Assignment {
    private static final Joiner.MapJoiner joiner = Joiner.on(", ").withKeyValueSeparator(": ");
    private static final Assignment EMPTY = new Assignment(new LinkedHashMap<>());

    private final Map<Variable, Value> values;

    private Assignment(LinkedHashMap<Variable, Value> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Assignment empty() { return EMPTY; }

    /**
     * @return an assignment binding each of the given variables to UNSET
     */
    public static Assignment unset(Iterable<Variable> variables) {
        LinkedHashMap<Variable, Value> m = new LinkedHashMap<>();
        for (Variable v : variables) m.put(v, Value.UNSET);
        return new Assignment(m);
    }

    /**
     * Build a complete assignment from truth values keyed by variable name.
     */
    public static Assignment of(Map<String, Boolean> truthValues) {
        LinkedHashMap<Variable, Value> m = new LinkedHashMap<>();
        truthValues.forEach((name, b) -> m.put(Expressions.variable(name), Value.of(b)));
        return new Assignment(m);
    }

    /**
     * @return the value bound to v; variables without a binding read as UNSET
     */
    public Value get(Variable v) {
        return values.getOrDefault(v, Value.UNSET);
    }

    public Assignment with(Variable v, Value value) {
        LinkedHashMap<Variable, Value> m = new LinkedHashMap<>(values);
        m.put(v, value);
        return new Assignment(m);
    }

    public Assignment with(Variable v, boolean b) {
        return with(v, Value.of(b));
    }

    /**
     * @return a copy of this assignment in which each binding of {@code other} replaces (or is
     * appended to) the binding here
     */
    public Assignment overriddenBy(Assignment other) {
        if (other.values.isEmpty()) return this;
        LinkedHashMap<Variable, Value> m = new LinkedHashMap<>(values);
        m.putAll(other.values);
        return new Assignment(m);
    }

    public Set<Variable> variables() { return values.keySet(); }

    public Map<Variable, Value> asMap() { return values; }

    public int size() { return values.size(); }

    public boolean isComplete() {
        return values.values().stream().allMatch(Value::isSet);
    }

    /**
     * @return the truth values of this assignment keyed by variable name, in iteration order
     * @throws IllegalStateException if some variable is UNSET
     */
    public ImmutableMap<String, Boolean> asBooleans() {
        ImmutableMap.Builder<String, Boolean> b = ImmutableMap.builder();
        values.forEach((v, value) -> {
            if (!value.isSet()) throw new IllegalStateException("variable " + v + " is unset");
            b.put(v.name(), value.toBoolean());
        });
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assignment && ((Assignment) o).values.equals(values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "{" + joiner.join(values) + "}"; }
}
