package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * A slot of the crossword: a run of open cells starting at (i, j) and
 * extending {@code length} cells in one direction.
 */
public final class Variable {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private final int i;  // row of first letter
    private final int j;  // column of first letter
    private final Direction direction;
    private final int length;

    public Variable(int i, int j, Direction direction, int length) {
        if (i < 0 || j < 0) throw new IllegalArgumentException("negative position " + i + "," + j);
        if (length < 1) throw new IllegalArgumentException("length must be positive: " + length);
        this.i = i;
        this.j = j;
        this.direction = Objects.requireNonNull(direction);
        this.length = length;
    }

    public int i() { return i; }
    public int j() { return j; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** @return row of the k-th letter of this slot */
    public int row(int k) { return i + (direction == Direction.DOWN ? k : 0); }

    /** @return column of the k-th letter of this slot */
    public int column(int k) { return j + (direction == Direction.ACROSS ? k : 0); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variable v = (Variable) o;
        return i == v.i && j == v.j && length == v.length && direction == v.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(i, j, direction, length);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) %s : %d", i, j, direction, length);
    }
}
