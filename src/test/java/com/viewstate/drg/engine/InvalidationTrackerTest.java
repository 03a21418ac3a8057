package com.viewstate.drg.engine;

import com.viewstate.drg.api.Node;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class InvalidationTrackerTest {

    private final InvalidationTracker tracker = new InvalidationTracker();

    // count -> doubled -> label ; other -> unrelated
    private final List<Node> nodes = List.of(
            new Node("doubled", List.of("count"), false, d -> null),
            new Node("label", List.of("doubled"), false, d -> null),
            new Node("unrelated", List.of("other"), false, d -> null));

    private static List<String> names(Set<Node> nodes) {
        List<String> out = new ArrayList<>();
        for (Node n : nodes)
            out.add(n.name());
        return out;
    }

    @Test
    public void testFieldChangeReachesTransitiveDependents() {
        assertEquals(List.of("doubled", "label"), names(tracker.affected(nodes, Set.of("count"), true)));
    }

    @Test
    public void testUntouchedBranchIsNotAffected() {
        assertFalse(names(tracker.affected(nodes, Set.of("count"), true)).contains("unrelated"));
    }

    @Test
    public void testIncludeSelfSelectsDirtyNode() {
        assertEquals(List.of("doubled", "label"), names(tracker.affected(nodes, Set.of("doubled"), true)));
    }

    @Test
    public void testExcludeSelfSelectsOnlyDependents() {
        assertEquals(List.of("label"), names(tracker.affected(nodes, Set.of("doubled"), false)));
    }

    @Test
    public void testLeafNodeWithoutSelfIsEmpty() {
        assertTrue(tracker.affected(nodes, Set.of("label"), false).isEmpty());
    }

    @Test
    public void testUnknownNamesAffectNothing() {
        assertTrue(tracker.affected(nodes, Set.of("nope"), true).isEmpty());
    }

    @Test
    public void testResultFollowsInputOrder() {
        List<Node> reversed = List.of(nodes.get(1), nodes.get(0));
        assertEquals(List.of("label", "doubled"), names(tracker.affected(reversed, Set.of("count"), true)));
    }
}
