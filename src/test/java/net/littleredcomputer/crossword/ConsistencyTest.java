package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import java.util.Collections;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ConsistencyTest extends CrosswordTestBase {

    private static Domains domains(Crossword c) {
        return Domains.of(c.variables(), c.words());
    }

    @Test
    public void nodeConsistencyKeepsWordsOfSlotLength() {
        Crossword c = fromResource("ring");
        Domains d = domains(c);
        new Consistency(c, d).enforceNodeConsistency();
        for (Variable v : d.variables()) {
            assertThat(d.get(v), is(not(empty())));
            assertThat(d.get(v), everyItem(matchesPattern("[A-Z]{4}")));
            assertThat(d.get(v), not(hasItem("TOAST")));
        }
    }

    @Test
    public void nodeConsistencyCanEmptyADomain() {
        Crossword c = crossword("____", "cat", "dog");
        Domains d = domains(c);
        new Consistency(c, d).enforceNodeConsistency();
        assertThat(d.isEmpty(c.variables().iterator().next()), is(true));
    }

    @Test
    public void reviseRemovesUnsupportedWords() {
        Crossword c = crossword(corner, "cat", "cog", "dog");
        Domains d = domains(c);
        Consistency k = new Consistency(c, d);
        assertThat(k.revise(cornerAcross, cornerDown), is(true));
        // DOG would need another word beginning with D.
        assertThat(d.get(cornerAcross), contains("CAT", "COG"));
        assertThat(k.revise(cornerAcross, cornerDown), is(false));
    }

    @Test
    public void aWordCannotSupportItself() {
        // CAT and DOG are each matched only by themselves in the crossing slot.
        Crossword c = crossword(corner, "cat", "cog", "dog");
        Domains d = domains(c);
        d.removeIf(cornerDown, w -> !w.equals("DOG") && !w.equals("CAT"));
        new Consistency(c, d).revise(cornerAcross, cornerDown);
        assertThat(d.get(cornerAcross), contains("COG"));
    }

    @Test
    public void reviseWithoutOverlapIsANoOp() {
        Crossword c = crossword(parallel, "cat", "dog");
        Domains d = domains(c);
        Variable top = new Variable(0, 0, Variable.Direction.ACROSS, 3);
        Variable bottom = new Variable(2, 0, Variable.Direction.ACROSS, 3);
        assertThat(new Consistency(c, d).revise(top, bottom), is(false));
        assertThat(d.get(top), contains("CAT", "DOG"));
    }

    @Test
    public void ac3LeavesDomainsArcConsistent() {
        Crossword c = fromResource("ring");
        Domains d = domains(c);
        Consistency k = new Consistency(c, d);
        k.enforceNodeConsistency();
        assertThat(k.ac3(), is(true));
        assertArcConsistent(c, d);
        // These four fit the ring two ways round; everything else is pruned.
        for (Variable v : d.variables()) {
            assertThat(d.get(v), everyItem(isIn(ImmutableSet.of("CAKE", "COAT", "EAST", "TENT"))));
        }
    }

    @Test
    public void ac3ReportsEmptiedDomain() {
        Crossword c = crossword(corner, "cat", "dog");
        Domains d = domains(c);
        Consistency k = new Consistency(c, d);
        k.enforceNodeConsistency();
        assertThat(k.ac3(), is(false));
    }

    @Test
    public void ac3WithNoArcsSucceedsWithoutChange() {
        Crossword c = crossword(corner, "cat", "dog");
        Domains d = domains(c);
        Consistency k = new Consistency(c, d);
        ImmutableMap<Variable, ImmutableSet<String>> before = d.snapshot();
        assertThat(k.ac3(Collections.emptyList()), is(true));
        assertThat(d.snapshot(), is(before));
        assertThat(k.revisions(), is(0L));
    }

    @Test
    public void ac3FromGivenArcs() {
        Crossword c = crossword(corner, "cat", "cog", "dog");
        Domains d = domains(c);
        Consistency k = new Consistency(c, d);
        assertThat(k.ac3(ImmutableList.of(new Arc(cornerDown, cornerAcross))), is(true));
        assertThat(d.get(cornerDown), contains("CAT", "COG"));
        // The across slot is the only neighbor of the down slot, so nothing was queued after the change.
        assertThat(d.get(cornerAcross), contains("CAT", "COG", "DOG"));
    }

    @Test
    public void consistencyIsIdempotent() {
        Crossword c = fromResource("ring");
        Domains d = domains(c);
        Consistency k = new Consistency(c, d);
        k.enforceNodeConsistency();
        assertThat(k.ac3(), is(true));
        ImmutableMap<Variable, ImmutableSet<String>> once = d.snapshot();
        k.enforceNodeConsistency();
        assertThat(d.snapshot(), is(once));
        assertThat(k.ac3(), is(true));
        assertThat(d.snapshot(), is(once));
    }

    @Test
    public void arcsAreAllOrderedCrossingPairs() {
        Crossword c = crossword(corner, "cat");
        assertThat(new Consistency(c, domains(c)).arcs(), containsInAnyOrder(
                new Arc(cornerAcross, cornerDown), new Arc(cornerDown, cornerAcross)));
    }
}
