package com.viewstate.drg.util;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.api.PassKind;
import com.viewstate.drg.api.StabilizationListener;

import java.util.Arrays;

/**
 * Fans every callback out to a list of {@link StabilizationListener}s.
 * Listeners are kept in a copy-on-write array.
 */
public class CompositeStabilizationListener implements StabilizationListener {
    private volatile StabilizationListener[] listeners = new StabilizationListener[0];

    public synchronized void add(StabilizationListener listener) {
        StabilizationListener[] old = listeners;
        StabilizationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStabilizationStart(OwnerAddress owner, long generation, PassKind kind, int scheduled) {
        for (StabilizationListener l : listeners)
            l.onStabilizationStart(owner, generation, kind, scheduled);
    }

    @Override
    public void onNodeComputed(long generation, String nodeName, ComputationState state, boolean invoked,
            long durationNanos) {
        for (StabilizationListener l : listeners)
            l.onNodeComputed(generation, nodeName, state, invoked, durationNanos);
    }

    @Override
    public void onNodeError(long generation, String nodeName, Throwable error) {
        for (StabilizationListener l : listeners)
            l.onNodeError(generation, nodeName, error);
    }

    @Override
    public void onStabilizationEnd(OwnerAddress owner, long generation, int nodesComputed) {
        for (StabilizationListener l : listeners)
            l.onStabilizationEnd(owner, generation, nodesComputed);
    }
}
