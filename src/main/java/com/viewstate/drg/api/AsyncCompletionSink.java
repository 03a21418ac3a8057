package com.viewstate.drg.api;

/**
 * Receives the result of a finished async compute task.
 *
 * Called on the worker thread that ran the task. Implementations must not touch
 * the owner's store; they hand the result to the owner (typically by publishing
 * a single event into its mailbox) and return.
 */
@FunctionalInterface
public interface AsyncCompletionSink {

    /**
     * @param owner      address captured when the task was spawned
     * @param nodeName   the async node that ran
     * @param generation the owner's pass generation at spawn time
     * @param outcome    the captured result of compute
     */
    void complete(OwnerAddress owner, String nodeName, long generation, ComputeOutcome outcome);
}
