package com.viewstate.drg.runtime;

import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.api.StabilizationListener;
import com.viewstate.drg.engine.ComputationExecutor;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.engine.StabilizationEngine;
import com.viewstate.drg.store.InMemoryFieldStore;

import java.util.function.LongSupplier;

/** Graph, store and engine of one owner. */
public final class OwnerContext {
    private final OwnerAddress address;
    private final DependencyGraph graph;
    private final InMemoryFieldStore store;
    private final StabilizationEngine engine;

    OwnerContext(OwnerAddress address, DependencyGraph graph, ComputationExecutor executor,
            StabilizationListener listener, LongSupplier generations) {
        this.address = address;
        this.graph = graph;
        this.store = new InMemoryFieldStore(graph.definition());
        this.engine = new StabilizationEngine(address, graph, store, executor, generations);
        this.engine.setListener(listener);
    }

    public OwnerAddress address() {
        return address;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public InMemoryFieldStore store() {
        return store;
    }

    public StabilizationEngine engine() {
        return engine;
    }
}
