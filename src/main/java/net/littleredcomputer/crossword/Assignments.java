package net.littleredcomputer.crossword;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tests on (possibly partial) assignments of words to slots.
 */
public class Assignments {
    private final Crossword crossword;
    private final Domains domains;

    public Assignments(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /** @return true if every variable is bound to a nonempty word */
    public boolean isComplete(Map<Variable, String> assignment) {
        for (Variable v : domains.variables()) {
            String w = assignment.get(v);
            if (w == null || w.isEmpty()) return false;
        }
        return true;
    }

    /**
     * @return true if the words of the assignment are distinct, each fits its slot,
     * and every pair of bound, crossing slots agrees on the shared letter.
     */
    public boolean isConsistent(Map<Variable, String> assignment) {
        Set<String> seen = new HashSet<>();
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            String w = e.getValue();
            if (w == null || w.length() != e.getKey().length()) return false;
            if (!seen.add(w)) return false;
        }
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            Variable v = e.getKey();
            for (Variable n : crossword.neighbors(v)) {
                String nw = assignment.get(n);
                if (nw == null) continue;
                Optional<Overlap> o = crossword.overlap(v, n);
                if (o.isPresent() && !o.get().agrees(e.getValue(), nw)) return false;
            }
        }
        return true;
    }
}
