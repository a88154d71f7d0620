package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Depth-first backtracking search for a complete, consistent assignment. Variables are
 * chosen by minimum remaining values, ties going to the variable with the most crossings.
 */
public class Backtracking {
    private static final Logger log = LogManager.getFormatterLogger(Backtracking.class);
    private static final int logCheckSteps = 1000;

    public enum ValueOrdering {
        DOMAIN,              // as the domain iterates
        LEAST_CONSTRAINING,  // fewest conflicts with decided neighbors first
    }
    private ValueOrdering ordering = ValueOrdering.LEAST_CONSTRAINING;

    private final Crossword crossword;
    private final Domains domains;
    private final Assignments assignments;
    private long nodeCount = 0;
    private long lastNodeCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public Backtracking(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
        this.assignments = new Assignments(crossword, domains);
    }

    public Backtracking setValueOrdering(ValueOrdering ordering) {
        this.ordering = Objects.requireNonNull(ordering);
        return this;
    }

    public Backtracking setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /** @return number of tentative bindings made so far */
    public long nodeCount() { return nodeCount; }

    /**
     * Searches from the empty assignment.
     * @return a complete consistent assignment, or empty if there is none
     */
    public Optional<Map<Variable, String>> solve() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastNodeCount = nodeCount;
        Optional<Map<Variable, String>> result = backtrack(new LinkedHashMap<>());
        stopwatch.stop();
        log.info("%s after %d nodes in %s", result.isPresent() ? "solved" : "no solution", nodeCount, stopwatch);
        return result;
    }

    /**
     * @return the unbound variable with the smallest domain; among those, the one with
     * the most neighbors
     * @throws IllegalStateException if every variable is bound
     */
    Variable selectUnassignedVariable(Map<Variable, String> assignment) {
        Comparator<Variable> byDegree = Comparator.comparingInt(v -> crossword.neighbors(v).size());
        return domains.variables().stream()
                .filter(v -> !assignment.containsKey(v))
                .min(Comparator.<Variable>comparingInt(domains::size).thenComparing(byDegree.reversed()))
                .orElseThrow(() -> new IllegalStateException("no unassigned variables remaining"));
    }

    /**
     * @return the domain of {@code var}, in the order in which its words should be tried
     */
    List<String> orderDomainValues(Variable var, Map<Variable, String> assignment) {
        List<String> values = new ArrayList<>(domains.get(var));
        if (ordering == ValueOrdering.DOMAIN) return values;
        // A word that is still available to a decided neighbor is one that neighbor could
        // otherwise have used; count those and prefer the words with the fewest.
        TObjectIntMap<String> eliminations = new TObjectIntHashMap<>();
        for (String value : values) {
            int n = 0;
            for (Variable neighbor : crossword.neighbors(var)) {
                if (assignment.containsKey(neighbor) && domains.get(neighbor).contains(value)) ++n;
            }
            eliminations.put(value, n);
        }
        values.sort(Comparator.comparingInt(eliminations::get));
        return values;
    }

    /**
     * Extends {@code assignment} to a complete consistent assignment if possible. Every
     * binding made here is undone before returning, so {@code assignment} is left as it
     * was found; a solution is returned as an immutable copy.
     */
    Optional<Map<Variable, String>> backtrack(Map<Variable, String> assignment) {
        if (assignments.isComplete(assignment)) return Optional.of(ImmutableMap.copyOf(assignment));
        Variable var = selectUnassignedVariable(assignment);
        for (String value : orderDomainValues(var, assignment)) {
            ++nodeCount;
            if (nodeCount % logCheckSteps == 0) maybeReportProgress(assignment);
            assignment.put(var, value);
            try {
                if (assignments.isConsistent(assignment)) {
                    Optional<Map<Variable, String>> result = backtrack(assignment);
                    if (result.isPresent()) return result;
                }
            } finally {
                assignment.remove(var);
            }
        }
        return Optional.empty();
    }

    private void maybeReportProgress(Map<Variable, String> assignment) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (nodeCount - lastNodeCount) / Math.max(1, tween.toMillis());
        final int depth = assignment.size();
        log.info(() -> new FormattedMessage("%d nodes %s %.0f/sec depth %d/%d",
                nodeCount, stopwatch, perSec, depth, domains.variables().size()));
        lastLogTime = now;
        lastNodeCount = nodeCount;
    }
}
