package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Lists;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The structure of a crossword puzzle: which cells are open, the slots (variables)
 * formed by runs of open cells, where those slots cross, and the vocabulary
 * from which the slots are to be filled.
 */
public class Crossword {
    private final int width;
    private final int height;
    private final boolean[][] structure;  // true where a letter may be written
    private final ImmutableSet<String> words;
    private final ImmutableSet<Variable> variables;
    private final ImmutableTable<Variable, Variable, Overlap> overlaps;

    /**
     * @param rows one string per grid row; '_' marks an open cell, anything else is blocked.
     *             Rows shorter than the longest are padded with blocked cells.
     * @param words the vocabulary. Words are trimmed and upper-cased; blank entries are dropped.
     */
    public Crossword(List<String> rows, Iterable<String> words) {
        List<String> rs = new ArrayList<>(rows);
        while (!rs.isEmpty() && rs.get(rs.size() - 1).isEmpty()) rs.remove(rs.size() - 1);
        if (rs.isEmpty()) throw new IllegalArgumentException("empty crossword structure");
        height = rs.size();
        width = rs.stream().mapToInt(String::length).max().orElse(0);
        structure = new boolean[height][width];
        for (int i = 0; i < height; ++i) {
            String r = rs.get(i);
            for (int j = 0; j < r.length(); ++j) structure[i][j] = r.charAt(j) == '_';
        }

        ImmutableSet.Builder<String> wb = ImmutableSet.builder();
        for (String w : words) {
            String t = w.trim();
            if (!t.isEmpty()) wb.add(t.toUpperCase());
        }
        this.words = wb.build();

        this.variables = findVariables();
        this.overlaps = findOverlaps();
    }

    private boolean open(int i, int j) {
        return i >= 0 && i < height && j >= 0 && j < width && structure[i][j];
    }

    private ImmutableSet<Variable> findVariables() {
        ImmutableSet.Builder<Variable> vb = ImmutableSet.builder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                // A slot starts wherever an open cell has no open cell before it.
                if (!open(i, j - 1)) {
                    int length = 1;
                    while (open(i, j + length)) ++length;
                    if (length > 1) vb.add(new Variable(i, j, Variable.Direction.ACROSS, length));
                }
                if (!open(i - 1, j)) {
                    int length = 1;
                    while (open(i + length, j)) ++length;
                    if (length > 1) vb.add(new Variable(i, j, Variable.Direction.DOWN, length));
                }
            }
        }
        return vb.build();
    }

    private ImmutableTable<Variable, Variable, Overlap> findOverlaps() {
        // Record, for every cell, which slots pass through it and at what offset.
        List<List<Variable>> slotsAt = Lists.newArrayListWithCapacity(width * height);
        List<List<Integer>> offsetsAt = Lists.newArrayListWithCapacity(width * height);
        for (int c = 0; c < width * height; ++c) {
            slotsAt.add(new ArrayList<>(2));
            offsetsAt.add(new ArrayList<>(2));
        }
        for (Variable v : variables) {
            for (int k = 0; k < v.length(); ++k) {
                int c = v.row(k) * width + v.column(k);
                slotsAt.get(c).add(v);
                offsetsAt.get(c).add(k);
            }
        }
        ImmutableTable.Builder<Variable, Variable, Overlap> tb = ImmutableTable.builder();
        for (int c = 0; c < slotsAt.size(); ++c) {
            List<Variable> vs = slotsAt.get(c);
            List<Integer> ks = offsetsAt.get(c);
            for (int a = 0; a < vs.size(); ++a) {
                for (int b = 0; b < vs.size(); ++b) {
                    if (a != b) tb.put(vs.get(a), vs.get(b), new Overlap(ks.get(a), ks.get(b)));
                }
            }
        }
        return tb.build();
    }

    public int width() { return width; }
    public int height() { return height; }
    public boolean isOpen(int i, int j) { return open(i, j); }
    public ImmutableSet<String> words() { return words; }
    public ImmutableSet<Variable> variables() { return variables; }

    /** @return the slots that share a cell with {@code v} */
    public Set<Variable> neighbors(Variable v) {
        return overlaps.row(v).keySet();
    }

    /** @return the crossing of {@code x} with {@code y}, if they cross */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        return Optional.ofNullable(overlaps.get(x, y));
    }

    public static Crossword parseFrom(String structure, String words) {
        return parseFrom(new StringReader(structure), new StringReader(words));
    }

    /**
     * Reads a puzzle from its two textual parts.
     * @param structure grid, one line per row, '_' for open cells
     * @param words vocabulary, one word per line
     * @return the puzzle
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        List<String> rows = new BufferedReader(structure).lines().collect(Collectors.toList());
        List<String> vocabulary = new BufferedReader(words).lines().collect(Collectors.toList());
        return new Crossword(ImmutableList.copyOf(rows), vocabulary);
    }
}
