package com.viewstate.drg.engine;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.ComputeOutcome;
import com.viewstate.drg.api.Node;
import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Routes a finished async computation back to the owner that launched it.
 *
 * The result is addressed by owner, so a component's result never lands in
 * its parent view. On delivery:
 * 1. the owner is resolved; a result for an owner that is gone is dropped;
 * 2. a result older than the node's last write is dropped as stale;
 * 3. the outcome is written as Ready(value, async) or Failed;
 * 4. the node's dependents (not the node itself) are recomputed.
 */
public final class AsyncResultRouter {
    private static final Logger log = LogManager.getLogger(AsyncResultRouter.class);

    /** Looks up the engine of a live owner, or null when it no longer exists. */
    @FunctionalInterface
    public interface OwnerResolver {
        StabilizationEngine resolve(OwnerAddress owner);
    }

    public enum Delivery {
        APPLIED, STALE, UNKNOWN_OWNER, UNKNOWN_NODE
    }

    private final OwnerResolver resolver;
    private final ErrorRateLimiter errorLimiter;

    public AsyncResultRouter(OwnerResolver resolver) {
        this(resolver, new ErrorRateLimiter(log, 1000));
    }

    public AsyncResultRouter(OwnerResolver resolver, ErrorRateLimiter errorLimiter) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.errorLimiter = errorLimiter;
    }

    public Delivery deliver(OwnerAddress owner, String nodeName, long generation, ComputeOutcome outcome) {
        StabilizationEngine engine = resolver.resolve(owner);
        if (engine == null) {
            log.warn("Dropping result of {} for unknown owner {}", nodeName, owner);
            return Delivery.UNKNOWN_OWNER;
        }

        DependencyGraph graph = engine.graph();
        if (!graph.isNode(nodeName)) {
            log.warn("Dropping result for unknown node {} of {}", nodeName, owner);
            return Delivery.UNKNOWN_NODE;
        }
        Node node = graph.node(nodeName);
        if (!node.async()) {
            log.warn("Dropping async result for sync node {} of {}", nodeName, owner);
            return Delivery.UNKNOWN_NODE;
        }

        if (engine.isStale(nodeName, generation)) {
            log.debug("Discarding stale result of {} for {} (generation {})", nodeName, owner, generation);
            return Delivery.STALE;
        }

        ComputationState state = outcome.toState(true);
        engine.store().putNodeState(nodeName, state);
        if (outcome instanceof ComputeOutcome.Err err) {
            if (errorLimiter != null)
                errorLimiter.log(nodeName, "Async node " + nodeName + " of " + owner + " failed", err.cause());
            engine.reportError(nodeName, generation, err.cause());
        }

        engine.recomputeDependents(nodeName);
        return Delivery.APPLIED;
    }
}
