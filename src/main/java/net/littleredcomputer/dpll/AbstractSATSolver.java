package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    final Formula formula;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractSATSolver(String name, Formula formula) {
        this.name = name;
        this.formula = formula;
    }

    public String name() { return name; }
    public long stepCount() { return stepCount; }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
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

    /**
     * Log the outcome of a search and hand it back to the caller.
     */
    Optional<Map<Integer, Boolean>> report(Optional<Map<Integer, Boolean>> outcome) {
        if (stopwatch.isRunning()) stopwatch.stop();
        if (outcome.isPresent()) {
            log.info("%s: SATISFIABLE after %d steps in %s", name, stepCount, stopwatch);
            log.debug("%s: valuation %s", name, outcome.get());
        } else {
            log.info("%s: UNSATISFIABLE after %d steps in %s", name, stepCount, stopwatch);
        }
        return outcome;
    }

    /**
     * Decide the satisfiability of the formula.
     *
     * @return a satisfying valuation (variable number to truth value), or empty if none exists
     */
    public abstract Optional<Map<Integer, Boolean>> solve();
}
