package com.viewstate.drg.engine;

import com.viewstate.drg.api.*;
import com.viewstate.drg.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Evaluates a single node against the current store.
 *
 * Steps for one node:
 * 1. Gather: build a map from each dependency name to its current value. Fields
 * and props contribute their raw value. Nodes contribute their state, or null
 * if they have never been computed.
 * 2. Check: if any dependency is Loading the node is Loading. Otherwise the
 * first Failed dependency (in dependency order) is propagated unchanged.
 * Loading wins over Failed.
 * 3. Unwrap: Ready values are replaced by their inner value. If any of them came
 * from an async computation the node's sync result is marked async too.
 * 4. Compute:
 * - async node: write Loading and hand the compute to the background executor;
 * the result comes back through the {@link AsyncCompletionSink}.
 * - sync node: call the compute in place. A thrown error becomes Failed.
 *
 * A compute function is never invoked while any dependency is Loading or Failed.
 */
public final class ComputationExecutor {
    private static final Logger log = LogManager.getLogger(ComputationExecutor.class);

    private final Executor asyncExecutor;
    private final AsyncCompletionSink sink;
    private final ErrorRateLimiter errorLimiter;

    public ComputationExecutor(Executor asyncExecutor, AsyncCompletionSink sink) {
        this(asyncExecutor, sink, new ErrorRateLimiter(log, 1000));
    }

    public ComputationExecutor(Executor asyncExecutor, AsyncCompletionSink sink, ErrorRateLimiter errorLimiter) {
        this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.errorLimiter = errorLimiter;
    }

    /**
     * Result of evaluating one node.
     *
     * @param state   state written to the store
     * @param invoked whether the compute function ran (or was spawned)
     * @param error   the failure raised by this node's own compute, if any
     */
    public record Step(ComputationState state, boolean invoked, Throwable error) {
    }

    /**
     * Computes {@code node}, writes its new state into {@code store} and returns it.
     *
     * @param owner      the owner async results are addressed to
     * @param generation the pass this evaluation belongs to
     */
    public Step computeOne(Node node, FieldStore store, OwnerAddress owner, long generation) {
        ComputationState.Failed firstFailed = null;
        boolean anyLoading = false;
        boolean hadAsync = false;
        Map<String, Object> deps = new LinkedHashMap<>(node.dependsOn().size() * 2);

        for (String name : node.dependsOn()) {
            if (store.hasField(name)) {
                deps.put(name, store.getField(name));
                continue;
            }
            ComputationState state = store.getNodeState(name);
            if (state instanceof ComputationState.Loading) {
                anyLoading = true;
            } else if (state instanceof ComputationState.Failed f) {
                if (firstFailed == null)
                    firstFailed = f;
            } else if (state instanceof ComputationState.Ready r) {
                hadAsync |= r.async();
                deps.put(name, r.value());
            } else {
                deps.put(name, null);
            }
        }

        if (anyLoading)
            return write(store, node, ComputationState.loading(), false, null);
        if (firstFailed != null)
            return write(store, node, firstFailed, false, null);

        Map<String, Object> unwrapped = Collections.unmodifiableMap(deps);
        if (node.async())
            return spawn(node, store, owner, generation, unwrapped);

        ComputeOutcome outcome = ComputeOutcome.capture(node.compute(), unwrapped);
        ComputationState state = outcome.toState(hadAsync);
        Throwable error = null;
        if (outcome instanceof ComputeOutcome.Err err) {
            error = err.cause();
            if (errorLimiter != null)
                errorLimiter.log(node.name(), "Error computing node " + node.name() + " for " + owner, error);
        }
        return write(store, node, state, true, error);
    }

    private Step spawn(Node node, FieldStore store, OwnerAddress owner, long generation,
            Map<String, Object> deps) {
        final String name = node.name();
        final ComputeFn fn = node.compute();
        // Loading goes in first so a sink that delivers inline is not overwritten.
        store.putNodeState(name, ComputationState.loading());
        try {
            asyncExecutor.execute(() -> runTask(owner, name, generation, fn, deps));
        } catch (RejectedExecutionException e) {
            log.warn("Async task for node {} of {} was rejected", name, owner);
            return write(store, node, ComputationState.failed(e), true, e);
        }
        if (log.isTraceEnabled())
            log.trace("Spawned node {} of {} at generation {}", name, owner, generation);
        return new Step(ComputationState.loading(), true, null);
    }

    // The sink hears back even when the worker dies of a VM error.
    private void runTask(OwnerAddress owner, String name, long generation, ComputeFn fn,
            Map<String, Object> deps) {
        ComputeOutcome outcome = null;
        try {
            outcome = ComputeOutcome.capture(fn, deps);
        } catch (VirtualMachineError e) {
            outcome = ComputeOutcome.err(e);
            throw e;
        } finally {
            sink.complete(owner, name, generation, outcome);
        }
    }

    private static Step write(FieldStore store, Node node, ComputationState state, boolean invoked,
            Throwable error) {
        store.putNodeState(node.name(), state);
        return new Step(state, invoked, error);
    }
}
