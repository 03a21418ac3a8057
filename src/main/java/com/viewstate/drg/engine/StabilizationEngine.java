package com.viewstate.drg.engine;

import com.viewstate.drg.api.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.function.LongSupplier;

/**
 * Drives recomputation passes for one owner (a view or a mounted component).
 *
 * Three kinds of pass:
 *
 * 1. Full: every node, in full topological order. Used on mount.
 *
 * 2. Dirty: the store's dirty names are expanded by the
 * {@link InvalidationTracker} (including nodes that are themselves dirty),
 * ordered by the {@link TopologicalScheduler}, and computed. The dirty set is
 * cleared when the pass starts.
 *
 * 3. Dependents: after an async result for node N has been written, everything
 * downstream of N is recomputed. N itself is not, or its task would be
 * launched again.
 *
 * Generations:
 * Every pass increments the owner's generation and records it against each
 * node it writes. An async task carries the generation of the pass that
 * spawned it. When its result arrives, the result is stale if a later pass has
 * written the node since; see {@link #isStale}. Owners of one view draw their
 * generations from a shared source, so a component mounted again under the
 * same address starts above every generation its previous mount handed out.
 *
 * Not thread safe. All calls for one owner happen on its actor thread.
 */
public final class StabilizationEngine {
    private static final Logger log = LogManager.getLogger(StabilizationEngine.class);

    private final OwnerAddress owner;
    private final DependencyGraph graph;
    private final FieldStore store;
    private final ComputationExecutor executor;
    private final InvalidationTracker tracker = new InvalidationTracker();
    private final TopologicalScheduler scheduler = new TopologicalScheduler();

    // Generation of the pass that last wrote each node.
    private final Map<String, Long> writtenAt = new HashMap<>();

    // Null means generations are counted by this engine alone.
    private final LongSupplier generations;

    private long generation;
    private int lastStabilizedCount;
    private StabilizationListener listener;

    public StabilizationEngine(OwnerAddress owner, DependencyGraph graph, FieldStore store,
            ComputationExecutor executor) {
        this(owner, graph, store, executor, null);
    }

    /**
     * @param generations source of pass generations, shared by owners whose
     *                    results must never be confused with each other; it
     *                    must return strictly increasing values
     */
    public StabilizationEngine(OwnerAddress owner, DependencyGraph graph, FieldStore store,
            ComputationExecutor executor, LongSupplier generations) {
        this.generations = generations;
        this.owner = Objects.requireNonNull(owner, "owner");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void setListener(StabilizationListener listener) {
        this.listener = listener;
    }

    /** Recomputes every node. */
    public int recomputeAll() {
        store.clearDirty();
        return run(PassKind.FULL, graph.nodes());
    }

    /**
     * Recomputes what the pending dirty names affect.
     *
     * @return number of nodes computed; 0 when nothing was dirty
     */
    public int recomputeDirty() {
        Set<String> dirty = store.dirty();
        if (dirty.isEmpty())
            return 0;
        store.clearDirty();

        Set<Node> affected = tracker.affected(graph.nodes(), dirty, true);
        if (log.isDebugEnabled())
            log.debug("{}: dirty {} affects {} node(s)", owner, dirty, affected.size());
        return run(PassKind.DIRTY, scheduler.order(affected));
    }

    /** Recomputes everything downstream of {@code nodeName}, excluding the node itself. */
    public int recomputeDependents(String nodeName) {
        Set<Node> affected = tracker.affected(graph.nodes(), Set.of(nodeName), false);
        if (affected.isEmpty())
            return 0;
        return run(PassKind.DEPENDENTS, scheduler.order(affected));
    }

    /**
     * @return true if a pass newer than {@code taskGeneration} has written {@code nodeName}
     */
    public boolean isStale(String nodeName, long taskGeneration) {
        Long written = writtenAt.get(nodeName);
        return written != null && written > taskGeneration;
    }

    /** Forwards an async failure to the listener, tagged with the task's generation. */
    void reportError(String nodeName, long taskGeneration, Throwable error) {
        StabilizationListener l = listener;
        if (l != null)
            l.onNodeError(taskGeneration, nodeName, error);
    }

    private int run(PassKind kind, List<Node> order) {
        final long gen = generations != null ? generations.getAsLong() : generation + 1;
        generation = gen;
        final StabilizationListener l = this.listener;
        final boolean hasListener = l != null;
        int computed = 0;

        if (hasListener)
            l.onStabilizationStart(owner, gen, kind, order.size());

        try {
            for (Node node : order) {
                long nodeStart = 0;
                if (hasListener)
                    nodeStart = System.nanoTime();

                ComputationExecutor.Step step = executor.computeOne(node, store, owner, gen);
                writtenAt.put(node.name(), gen);
                computed++;

                if (hasListener) {
                    l.onNodeComputed(gen, node.name(), step.state(), step.invoked(), System.nanoTime() - nodeStart);
                    if (step.error() != null)
                        l.onNodeError(gen, node.name(), step.error());
                }
            }
        } finally {
            this.lastStabilizedCount = computed;
            if (hasListener)
                l.onStabilizationEnd(owner, gen, computed);
        }

        if (log.isTraceEnabled())
            log.trace("{}: {} pass {} computed {} node(s)", owner, kind, gen, computed);
        return computed;
    }

    public OwnerAddress owner() {
        return owner;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public FieldStore store() {
        return store;
    }

    public long generation() {
        return generation;
    }

    public int lastStabilizedCount() {
        return lastStabilizedCount;
    }
}
