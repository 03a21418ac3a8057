package com.viewstate.drg.engine;

import com.viewstate.drg.api.Node;
import com.viewstate.drg.dsl.ViewDefinition;
import com.viewstate.drg.resource.ResourceGateway;

import java.util.*;

/**
 * Compiled, immutable node graph of one view or component definition.
 *
 * Holds every node in full topological order, a name index, and the reverse
 * edges (direct dependents of each name). Compiling validates the definition:
 * unresolvable references, name clashes and cycles all fail here, before any
 * owner is created.
 *
 * One graph is shared by every owner built from the same definition.
 */
public final class DependencyGraph {
    private final ViewDefinition definition;
    private final List<Node> nodes;
    private final Map<String, Node> byName;
    private final Map<String, List<String>> dependents;

    private DependencyGraph(ViewDefinition definition, List<Node> ordered) {
        this.definition = definition;
        this.nodes = List.copyOf(ordered);

        Map<String, Node> index = new LinkedHashMap<>();
        Map<String, List<String>> reverse = new HashMap<>();
        for (Node n : ordered) {
            index.put(n.name(), n);
            for (String dep : n.dependsOn())
                reverse.computeIfAbsent(dep, k -> new ArrayList<>()).add(n.name());
        }
        this.byName = Collections.unmodifiableMap(index);
        Map<String, List<String>> frozen = new HashMap<>();
        reverse.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.dependents = Collections.unmodifiableMap(frozen);
    }

    /**
     * Expands and orders the declarations of {@code definition}.
     *
     * @throws com.viewstate.drg.api.GraphConfigurationException if the definition is invalid
     */
    public static DependencyGraph compile(ViewDefinition definition, ResourceGateway gateway) {
        List<Node> expanded = new NodeBuilder(gateway).build(definition);
        List<Node> ordered = new TopologicalScheduler().order(expanded);
        return new DependencyGraph(definition, ordered);
    }

    public ViewDefinition definition() {
        return definition;
    }

    public String name() {
        return definition.name();
    }

    /** All nodes, dependencies first. */
    public List<Node> nodes() {
        return nodes;
    }

    public Node node(String name) {
        Node n = byName.get(name);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return n;
    }

    public boolean isNode(String name) {
        return byName.containsKey(name);
    }

    public int nodeCount() {
        return nodes.size();
    }

    /** Nodes that name {@code name} directly in their dependency list. */
    public List<String> dependents(String name) {
        return dependents.getOrDefault(name, List.of());
    }

    /**
     * Nodes that read {@code resource}. Marking these dirty is how a resource
     * change notification reaches the graph.
     */
    public Set<String> namesForResource(String resource) {
        Set<String> out = new LinkedHashSet<>();
        for (Node n : nodes)
            if (n.reads().contains(resource))
                out.add(n.name());
        return out;
    }

    @Override
    public String toString() {
        return "DependencyGraph[" + definition.name() + ", nodes=" + byName.keySet() + "]";
    }
}
