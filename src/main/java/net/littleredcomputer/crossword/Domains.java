package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.*;
import java.util.function.Predicate;

/**
 * The words still considered possible for each variable. Each variable owns its own
 * set; words can be removed from a domain but never put back.
 */
public class Domains {
    private final Map<Variable, Set<String>> domains = new LinkedHashMap<>();

    private Domains() {}

    /**
     * @return a store in which every variable's domain is (a private copy of) the whole vocabulary
     */
    public static Domains of(Iterable<Variable> variables, Collection<String> vocabulary) {
        Domains d = new Domains();
        for (Variable v : variables) d.domains.put(v, new LinkedHashSet<>(vocabulary));
        return d;
    }

    private Set<String> domain(Variable v) {
        Set<String> d = domains.get(v);
        if (d == null) throw new IllegalArgumentException("unknown variable: " + v);
        return d;
    }

    public Set<Variable> variables() { return Collections.unmodifiableSet(domains.keySet()); }
    public Set<String> get(Variable v) { return Collections.unmodifiableSet(domain(v)); }
    public int size(Variable v) { return domain(v).size(); }
    public boolean isEmpty(Variable v) { return domain(v).isEmpty(); }

    /** @return true if any word was removed */
    public boolean removeIf(Variable v, Predicate<String> p) {
        return domain(v).removeIf(p);
    }

    /** @return true if any word was removed */
    public boolean removeAll(Variable v, Collection<String> words) {
        return domain(v).removeAll(words);
    }

    public Domains copy() {
        Domains d = new Domains();
        domains.forEach((v, ws) -> d.domains.put(v, new LinkedHashSet<>(ws)));
        return d;
    }

    /** @return an immutable picture of the current state of every domain */
    public ImmutableMap<Variable, ImmutableSet<String>> snapshot() {
        ImmutableMap.Builder<Variable, ImmutableSet<String>> b = ImmutableMap.builder();
        domains.forEach((v, ws) -> b.put(v, ImmutableSet.copyOf(ws)));
        return b.build();
    }

    @Override
    public String toString() {
        return domains.toString();
    }
}
