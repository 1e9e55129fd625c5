package net.littleredcomputer.boolsat;

import java.util.List;
import java.util.Optional;

/**
 * Branching policy for {@link BacktrackingSolver}. The solver calls {@link #select} once per
 * search node. Any legal answer gives a correct result; the policy only affects how much of
 * the search tree gets explored.
 */
@FunctionalInterface
public interface VariableSelector {
    /**
     * @param variables every variable of the expression, in extraction order
     * @param assignment the current partial assignment
     * @return a variable that is UNSET in {@code assignment}, with the value to try first; or
     * empty exactly when no variable in {@code variables} is UNSET
     */
    Optional<Choice> select(List<Variable> variables, Assignment assignment);
}
