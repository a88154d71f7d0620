package net.littleredcomputer.crossword;

import java.util.Objects;

/** A pending revision: make the domain of {@code x} consistent with that of {@code y}. */
public final class Arc {
    final Variable x;
    final Variable y;

    public Arc(Variable x, Variable y) {
        this.x = Objects.requireNonNull(x);
        this.y = Objects.requireNonNull(y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arc arc = (Arc) o;
        return x.equals(arc.x) && y.equals(arc.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return x + " -> " + y;
    }
}
