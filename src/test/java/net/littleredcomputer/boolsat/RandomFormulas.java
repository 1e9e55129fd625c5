package net.littleredcomputer.boolsat;

import java.util.List;
import java.util.Random;

import static net.littleredcomputer.boolsat.Expressions.*;

/**
 * Seeded generator of small random expressions over a fixed pool of variables.
 */
class RandomFormulas {
    private final Random R;
    private final List<Variable> pool;

    RandomFormulas(long seed, List<Variable> pool) {
        this.R = new Random(seed);
        this.pool = pool;
    }

    BooleanExpr next(int depth) {
        Formula f = formula(depth);
        return f instanceof BooleanExpr ? (BooleanExpr) f : and(f);
    }

    private Formula formula(int depth) {
        if (depth == 0 || R.nextInt(4) == 0) return pool.get(R.nextInt(pool.size()));
        switch (R.nextInt(5)) {
            case 0: return not(formula(depth - 1));
            case 1: return implies(formula(depth - 1), formula(depth - 1));
            case 2: return xor(formula(depth - 1), formula(depth - 1));
            case 3: return and(operands(depth - 1));
            default: return or(operands(depth - 1));
        }
    }

    // Zero to three operands, so the vacuous cases turn up too.
    private Formula[] operands(int depth) {
        Formula[] fs = new Formula[R.nextInt(4)];
        for (int i = 0; i < fs.length; ++i) fs[i] = formula(depth);
        return fs;
    }
}
