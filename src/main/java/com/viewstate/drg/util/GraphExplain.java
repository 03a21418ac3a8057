package com.viewstate.drg.util;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.Node;
import com.viewstate.drg.dsl.FieldDefinition;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.engine.StabilizationEngine;
import com.viewstate.drg.engine.TopologicalScheduler;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting an owner's graph and current state.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error logs. Do <b>not</b>
 * call it on every pass (allocates strings, walks the whole graph).
 */
public final class GraphExplain {
    private final StabilizationEngine engine;
    private final DependencyGraph graph;

    public GraphExplain(StabilizationEngine engine) {
        this.engine = engine;
        this.graph = engine.graph();
    }

    /**
     * Dumps the definition and current state of a single node.
     */
    public String explainNode(String nodeName) {
        Node node = graph.node(nodeName);
        List<String> dependents = graph.dependents(nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Async: ").append(node.async()).append('\n')
                .append("  Depends on: ").append(String.join(", ", node.dependsOn())).append('\n');
        if (!node.reads().isEmpty())
            sb.append("  Reads: ").append(String.join(", ", node.reads())).append('\n');
        sb.append("  State: ").append(engine.store().getNodeState(nodeName)).append('\n')
                .append("  Dependents (").append(dependents.size()).append("): ")
                .append(String.join(", ", dependents));
        return sb.append('\n').toString();
    }

    /**
     * Summary of the last pass.
     */
    public String explainLastStabilization() {
        return engine.owner() + " generation: " + engine.generation() + ", Recomputed: "
                + engine.lastStabilizedCount() + "/" + graph.nodeCount();
    }

    /**
     * Dumps fields and nodes, nodes in execution order with their depth.
     */
    public String dumpTopology() {
        Map<String, Integer> depths = new TopologicalScheduler().depths(graph.nodes());
        Map<String, FieldDefinition> fields = graph.definition().fields();

        StringBuilder sb = new StringBuilder(1024);
        sb.append("View ").append(graph.name()).append(" (").append(fields.size()).append(" fields, ")
                .append(graph.definition().props().size()).append(" props, ")
                .append(graph.nodeCount()).append(" nodes):\n");
        for (FieldDefinition f : fields.values())
            sb.append("  field ").append(f.name()).append(" : ").append(f.type())
                    .append(" (").append(f.storage()).append(")\n");
        for (String p : graph.definition().props())
            sb.append("  prop ").append(p).append('\n');
        for (Node n : graph.nodes()) {
            sb.append("  [").append(depths.get(n.name())).append("] ").append(n.name());
            if (n.async())
                sb.append(" (ASYNC)");
            if (!n.dependsOn().isEmpty())
                sb.append(" <- ").append(String.join(", ", n.dependsOn()));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, one box per field, prop and node,
     * labelled with the node's current state.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Inputs first, then nodes
        for (String f : graph.definition().fields().keySet())
            sb.append("  ").append(sanitize(f)).append("[/\"").append(f).append("\"/];\n");
        for (String p : graph.definition().props())
            sb.append("  ").append(sanitize(p)).append("[(\"").append(p).append("\")];\n");
        for (Node n : graph.nodes()) {
            ComputationState state = engine.store().getNodeState(n.name());
            sb.append("  ").append(sanitize(n.name())).append("[\"").append(n.name())
                    .append("<br/>").append(escape(stateLabel(state))).append("\"];\n");
        }

        // 2. Edges afterwards
        for (Node n : graph.nodes()) {
            String dashes = n.async() ? " -.-> " : " --> ";
            for (String dep : n.dependsOn())
                sb.append("  ").append(sanitize(dep)).append(dashes).append(sanitize(n.name())).append(";\n");
        }
        return sb.toString();
    }

    private static String stateLabel(ComputationState state) {
        if (state == null)
            return "(not computed)";
        if (state instanceof ComputationState.Ready r)
            return r.async() ? "ready~" : "ready";
        if (state instanceof ComputationState.Failed f)
            return "failed: " + f.reason();
        return "loading";
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "'");
    }
}
