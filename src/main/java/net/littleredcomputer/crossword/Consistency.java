package net.littleredcomputer.crossword;

import gnu.trove.map.TCharIntMap;
import gnu.trove.map.hash.TCharIntHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shrinks domains by unary (word length) and binary (crossing letter) reasoning.
 */
public class Consistency {
    private static final Logger log = LogManager.getFormatterLogger(Consistency.class);
    private final Crossword crossword;
    private final Domains domains;
    private long revisions = 0;

    public Consistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /** Removes from each domain the words whose length does not fit the slot. */
    public void enforceNodeConsistency() {
        for (Variable v : domains.variables()) {
            final int length = v.length();
            domains.removeIf(v, w -> w.length() != length);
            log.debug("%s: %d words of length %d", v, domains.size(v), length);
        }
    }

    /**
     * Makes {@code x} arc consistent with {@code y}: a word stays in x's domain only if
     * some other word in y's domain has the same letter in the shared cell. (A word
     * cannot support itself, since two slots may not hold the same word.)
     * @return true if the domain of x was changed
     */
    public boolean revise(Variable x, Variable y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        ++revisions;
        final int xi = o.get().first();
        final int yi = o.get().second();
        final Set<String> ys = domains.get(y);
        // How many words of y carry each letter at the crossing.
        final TCharIntMap support = new TCharIntHashMap();
        for (String u : ys) {
            if (yi < u.length()) support.adjustOrPutValue(u.charAt(yi), 1, 1);
        }
        return domains.removeIf(x, w -> {
            if (xi >= w.length()) return true;
            char c = w.charAt(xi);
            int n = support.get(c);
            if (yi < w.length() && w.charAt(yi) == c && ys.contains(w)) --n;
            return n <= 0;
        });
    }

    /** @return every ordered pair of crossing slots */
    public List<Arc> arcs() {
        List<Arc> arcs = new ArrayList<>();
        for (Variable x : domains.variables()) {
            for (Variable y : crossword.neighbors(x)) arcs.add(new Arc(x, y));
        }
        return arcs;
    }

    /**
     * Runs AC-3 starting from every arc of the puzzle.
     * @return false if some domain was emptied
     */
    @CheckReturnValue
    public boolean ac3() {
        return ac3(arcs());
    }

    /**
     * Runs AC-3 starting from the given arcs. An empty collection succeeds at once.
     * @return false if some domain was emptied
     */
    @CheckReturnValue
    public boolean ac3(Collection<Arc> arcs) {
        if (arcs.isEmpty()) return true;
        final long revisionsBefore = revisions;
        Deque<Arc> queue = new ArrayDeque<>(arcs);
        while (!queue.isEmpty()) {
            Arc a = queue.removeLast();
            if (revise(a.x, a.y)) {
                if (domains.isEmpty(a.x)) {
                    log.debug("arc consistency emptied the domain of %s after %d revisions",
                            a.x, revisions - revisionsBefore);
                    return false;
                }
                // Anything that was consistent with the old domain of x must be checked again.
                for (Variable n : crossword.neighbors(a.x)) {
                    if (!n.equals(a.y)) queue.addLast(new Arc(n, a.x));
                }
            }
        }
        log.debug("arc consistent after %d revisions", revisions - revisionsBefore);
        return true;
    }

    long revisions() { return revisions; }
}
