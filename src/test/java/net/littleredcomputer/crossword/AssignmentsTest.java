package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class AssignmentsTest extends CrosswordTestBase {
    private final Crossword c = crossword(corner, "cat", "cog", "dog", "cattle");
    private final Assignments a = new Assignments(c, Domains.of(c.variables(), c.words()));

    @Test
    public void complete() {
        assertThat(a.isComplete(ImmutableMap.of()), is(false));
        assertThat(a.isComplete(ImmutableMap.of(cornerAcross, "CAT")), is(false));
        assertThat(a.isComplete(ImmutableMap.of(cornerAcross, "CAT", cornerDown, "COG")), is(true));
        assertThat(a.isComplete(ImmutableMap.of(cornerAcross, "CAT", cornerDown, "")), is(false));
        Map<Variable, String> withNull = new HashMap<>();
        withNull.put(cornerAcross, "CAT");
        withNull.put(cornerDown, null);
        assertThat(a.isComplete(withNull), is(false));
    }

    @Test
    public void crossingLettersMustAgree() {
        assertThat(a.isConsistent(ImmutableMap.of(cornerAcross, "CAT", cornerDown, "COG")), is(true));
        assertThat(a.isConsistent(ImmutableMap.of(cornerAcross, "CAT", cornerDown, "DOG")), is(false));
    }

    @Test
    public void wordsMustBeDistinct() {
        assertThat(a.isConsistent(ImmutableMap.of(cornerAcross, "CAT", cornerDown, "CAT")), is(false));
    }

    @Test
    public void wordsMustFitTheirSlots() {
        assertThat(a.isConsistent(ImmutableMap.of(cornerAcross, "CATTLE")), is(false));
    }

    @Test
    public void partialAssignmentsCanBeConsistent() {
        assertThat(a.isConsistent(ImmutableMap.of()), is(true));
        assertThat(a.isConsistent(ImmutableMap.of(cornerDown, "DOG")), is(true));
    }
}
