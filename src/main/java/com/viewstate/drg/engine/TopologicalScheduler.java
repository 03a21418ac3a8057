package com.viewstate.drg.engine;

import com.viewstate.drg.api.GraphConfigurationException;
import com.viewstate.drg.api.Node;

import java.util.*;

/**
 * Orders a set of nodes so that every node comes after all of its dependencies.
 *
 * Algorithm: Longest Dependency Chain
 * Each node gets a depth: 0 when none of its dependencies is a node of the
 * input set, otherwise 1 + the maximum depth of those dependencies. Sorting by
 * ascending depth is a valid topological order because a node's depth is
 * always strictly greater than any dependency's depth.
 *
 * Depths are memoized per call, so each node is visited once. A node reached
 * again while its own depth is still being computed closes a cycle; the
 * exception names the full path.
 *
 * Ties keep the input order (the sort is stable), which makes the output
 * deterministic for a given input list.
 */
public final class TopologicalScheduler {

    /**
     * @param nodes any subset of a graph; dependencies outside it are ignored
     * @return the same nodes in a valid execution order
     * @throws GraphConfigurationException if the subset contains a cycle
     */
    public List<Node> order(Collection<Node> nodes) {
        Map<String, Integer> depths = depths(nodes);
        List<Node> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparingInt(n -> depths.get(n.name())));
        return ordered;
    }

    /**
     * Computes the longest-chain depth of every node in {@code nodes}.
     */
    public Map<String, Integer> depths(Collection<Node> nodes) {
        Map<String, Node> byName = new LinkedHashMap<>(nodes.size() * 2);
        for (Node n : nodes)
            byName.put(n.name(), n);

        Map<String, Integer> depths = new HashMap<>(nodes.size() * 2);
        LinkedHashSet<String> inProgress = new LinkedHashSet<>();
        for (Node n : nodes)
            depthOf(n, byName, depths, inProgress);
        return depths;
    }

    private int depthOf(Node node, Map<String, Node> byName, Map<String, Integer> depths,
            LinkedHashSet<String> inProgress) {
        Integer known = depths.get(node.name());
        if (known != null)
            return known;
        if (!inProgress.add(node.name()))
            throw cycle(node.name(), inProgress);

        int depth = 0;
        for (String dep : node.dependsOn()) {
            Node depNode = byName.get(dep);
            if (depNode != null)
                depth = Math.max(depth, 1 + depthOf(depNode, byName, depths, inProgress));
        }

        inProgress.remove(node.name());
        depths.put(node.name(), depth);
        return depth;
    }

    private static GraphConfigurationException cycle(String reentered, LinkedHashSet<String> inProgress) {
        StringBuilder path = new StringBuilder();
        boolean inCycle = false;
        for (String name : inProgress) {
            if (name.equals(reentered))
                inCycle = true;
            if (inCycle)
                path.append(name).append(" -> ");
        }
        path.append(reentered);
        return new GraphConfigurationException(reentered, "Dependency cycle detected: " + path);
    }
}
