package com.viewstate.drg.api;

/**
 * Observability interface for monitoring stabilization passes.
 *
 * Implementations can be registered with a StabilizationEngine to receive
 * callbacks during each pass. This is the primary mechanism for:
 *
 * - Profiling: how long each compute takes.
 * - Debugging: which nodes a given mutation actually touched.
 * - Testing: counting compute invocations per node.
 *
 * Threading:
 * Callbacks run on the owner thread, inside the pass. Async tasks report their
 * result later through a separate DEPENDENTS pass, so a node's async compute
 * never shows up here directly; its launch does (with a Loading state).
 */
public interface StabilizationListener {

    /**
     * Called immediately before a pass begins.
     *
     * @param owner      the owner running the pass
     * @param generation the pass generation (monotonic per owner)
     * @param kind       what triggered the pass
     * @param scheduled  number of nodes scheduled in this pass
     */
    void onStabilizationStart(OwnerAddress owner, long generation, PassKind kind, int scheduled);

    /**
     * Called after a node's state has been written.
     *
     * @param generation    current pass generation
     * @param nodeName      the node
     * @param state         the state just written
     * @param invoked       true if compute ran (or was launched); false if a
     *                      Loading/Failed dependency state was propagated
     * @param durationNanos time spent on the node
     */
    void onNodeComputed(long generation, String nodeName, ComputationState state, boolean invoked,
            long durationNanos);

    /**
     * Called when a node's own compute function failed.
     *
     * @param generation current pass generation
     * @param nodeName   the failing node
     * @param error      what compute threw
     */
    void onNodeError(long generation, String nodeName, Throwable error);

    /**
     * Called when a pass is complete.
     *
     * @param owner         the owner that ran the pass
     * @param generation    pass generation
     * @param nodesComputed number of nodes whose state was written
     */
    void onStabilizationEnd(OwnerAddress owner, long generation, int nodesComputed);
}
