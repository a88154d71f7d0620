package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Fills a crossword: enforce node consistency, then arc consistency, then search.
 * Each instance owns its domains, so solving one puzzle never disturbs another.
 */
public class CrosswordCreator {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordCreator.class);
    private final Crossword crossword;
    private final Domains domains;
    private final Consistency consistency;
    private final Backtracking search;

    public CrosswordCreator(Crossword crossword) {
        this.crossword = crossword;
        this.domains = Domains.of(crossword.variables(), crossword.words());
        this.consistency = new Consistency(crossword, domains);
        this.search = new Backtracking(crossword, domains);
    }

    public CrosswordCreator setValueOrdering(Backtracking.ValueOrdering ordering) {
        search.setValueOrdering(ordering);
        return this;
    }

    public CrosswordCreator setLogInterval(Duration logInterval) {
        search.setLogInterval(logInterval);
        return this;
    }

    Domains domains() { return domains; }
    Consistency consistency() { return consistency; }
    Backtracking search() { return search; }

    /**
     * @return an assignment of a distinct word to every slot, agreeing at every crossing,
     * or empty if none exists
     */
    public Optional<Map<Variable, String>> solve() {
        log.info("%dx%d grid, %d slots, %d words",
                crossword.width(), crossword.height(), crossword.variables().size(), crossword.words().size());
        consistency.enforceNodeConsistency();
        if (!consistency.ac3()) {
            log.info("no solution: arc consistency emptied a domain");
            return Optional.empty();
        }
        return search.solve();
    }

    /**
     * @return the letters of the assignment laid out on the grid; null where nothing is written
     */
    public Character[][] letterGrid(Map<Variable, String> assignment) {
        Character[][] letters = new Character[crossword.height()][crossword.width()];
        assignment.forEach((v, w) -> {
            for (int k = 0; k < w.length(); ++k) letters[v.row(k)][v.column(k)] = w.charAt(k);
        });
        return letters;
    }

    /**
     * @return the grid as text, one line per row, with blocked cells drawn as solid blocks
     */
    public String render(Map<Variable, String> assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < crossword.height(); ++i) {
            for (int j = 0; j < crossword.width(); ++j) {
                if (crossword.isOpen(i, j)) s.append(letters[i][j] != null ? letters[i][j] : ' ');
                else s.append('█');
            }
            s.append('\n');
        }
        return s.toString();
    }
}
