package com.viewstate.drg.api;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A node in the dependency graph.
 *
 * Every declaration kind (plain derive, read-by-id, form) is expanded into this
 * one record by the NodeBuilder, so the scheduler, the invalidation tracker and
 * the executor only ever see a single shape.
 *
 * Key Responsibilities:
 *
 * 1. Identity: the name is unique within an owner. It is the key under which the
 * node's ComputationState is stored in the FieldStore.
 *
 * 2. Dependencies: dependsOn is the ordered list of bare names this node reads.
 * Each name is a field, a prop or another node. The order matters: when several
 * dependencies have failed, the first one in this list wins.
 *
 * 3. Computation: compute is invoked with a map from dependency name to its
 * plain (unwrapped) value. Async nodes run it on a worker thread; sync nodes run
 * it inline on the owner thread.
 *
 * 4. Invalidation: reads lists the external resource identifiers this node
 * depends on. The engine itself never looks at them; they only map a
 * cross-process resource change to node names.
 *
 * @param name      unique node name within its owner
 * @param dependsOn ordered dependency names
 * @param async     whether compute runs in a background task
 * @param compute   the computation
 * @param reads     external resources read by compute
 */
public record Node(String name, List<String> dependsOn, boolean async, ComputeFn compute, Set<String> reads) {

    public Node {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(compute, "compute");
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        reads = reads == null ? Set.of() : Set.copyOf(reads);
    }

    public Node(String name, List<String> dependsOn, boolean async, ComputeFn compute) {
        this(name, dependsOn, async, compute, Set.of());
    }

    public boolean dependsOn(String dependency) {
        return dependsOn.contains(dependency);
    }

    @Override
    public String toString() {
        return "Node[" + name + (async ? ", async" : "") + " <- " + dependsOn + "]";
    }
}
