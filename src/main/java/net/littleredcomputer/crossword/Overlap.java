package net.littleredcomputer.crossword;

/**
 * Where two slots cross: letter {@code first} of the first slot's word shares a cell
 * with letter {@code second} of the second slot's word.
 */
public final class Overlap {
    private final int first;
    private final int second;

    public Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public int first() { return first; }
    public int second() { return second; }

    /** @return the same crossing seen from the other slot */
    public Overlap reversed() { return new Overlap(second, first); }

    /**
     * @return true if {@code x} and {@code y} have the same letter at the shared cell.
     * A word too short to reach the cell agrees with nothing.
     */
    boolean agrees(String x, String y) {
        return first < x.length() && second < y.length() && x.charAt(first) == y.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Overlap overlap = (Overlap) o;
        return first == overlap.first && second == overlap.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
