package net.littleredcomputer.boolsat;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Bookkeeping shared by the solvers: the expression and its variables, a step counter, and
 * rate-limited progress logging.
 */
abstract class AbstractSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSolver.class);
    final int logCheckSteps = 10000;
    final BooleanExpr expr;
    final ImmutableList<Variable> variables;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    AbstractSolver(String name, BooleanExpr expr) {
        this.name = name;
        this.expr = expr;
        this.variables = VariableExtractor.extract(expr).asList();
    }

    public void setLogInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("log interval must be positive: " + interval);
        }
        logInterval = interval;
    }

    public ImmutableList<Variable> variables() { return variables; }

    void start() {
        stepCount = 0;
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
        log.debug("%s starting on %d variables: %s", name, variables.size(), expr);
    }

    void finish(boolean satisfiable) {
        stopwatch.stop();
        log.debug("%s %s after %d steps in %s", name, satisfiable ? "SATISFIABLE" : "UNSATISFIABLE", stepCount, stopwatch);
    }

    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;

    // One character per variable in extraction order: 0, 1, or . for unset.
    String stateToString(Assignment a) {
        StringBuilder s = new StringBuilder();
        for (Variable v : variables) {
            switch (a.get(v)) {
                case TRUE: s.append('1'); break;
                case FALSE: s.append('0'); break;
                default: s.append('.');
            }
        }
        if (s.length() > 100) {
            return s.substring(0, initialStateSegment) + "..." + s.substring(s.length() - finalStateSegment);
        }
        return s.toString();
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    void maybeReportProgress(Assignment a) {
        maybeReportProgress(() -> stateToString(a));
    }
}
