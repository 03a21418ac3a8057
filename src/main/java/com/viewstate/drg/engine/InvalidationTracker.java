package com.viewstate.drg.engine;

import com.viewstate.drg.api.Node;

import java.util.*;

/**
 * Computes which nodes must be recomputed for a set of changed names.
 *
 * Two phases:
 * 1. Direct: nodes with a dependency in the changed set. With
 * {@code includeSelf}, also nodes whose own name is in the changed set (an
 * externally invalidated node must rerun itself).
 * 2. Closure: keep adding nodes that depend on an already affected node until
 * nothing changes. Only node names ever enter the affected set; fields are
 * leaves.
 *
 * includeSelf only applies to phase 1, which is why the phases are separate.
 */
public final class InvalidationTracker {

    /**
     * @param allNodes    every node of the owner
     * @param dirty       changed field, prop or node names
     * @param includeSelf also select nodes named in {@code dirty}
     * @return affected nodes, in {@code allNodes} order
     */
    public Set<Node> affected(List<Node> allNodes, Set<String> dirty, boolean includeSelf) {
        Set<String> affected = new HashSet<>();

        for (Node node : allNodes) {
            boolean depsDirty = false;
            for (String dep : node.dependsOn()) {
                if (dirty.contains(dep)) {
                    depsDirty = true;
                    break;
                }
            }
            boolean selfDirty = includeSelf && dirty.contains(node.name());
            if (depsDirty || selfDirty)
                affected.add(node.name());
        }

        boolean grew = !affected.isEmpty();
        while (grew) {
            grew = false;
            for (Node node : allNodes) {
                if (affected.contains(node.name()))
                    continue;
                for (String dep : node.dependsOn()) {
                    if (affected.contains(dep)) {
                        affected.add(node.name());
                        grew = true;
                        break;
                    }
                }
            }
        }

        Set<Node> result = new LinkedHashSet<>();
        for (Node node : allNodes)
            if (affected.contains(node.name()))
                result.add(node);
        return result;
    }
}
