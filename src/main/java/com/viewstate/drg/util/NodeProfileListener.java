package com.viewstate.drg.util;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.api.PassKind;
import com.viewstate.drg.api.StabilizationListener;

import java.util.*;

/** Aggregates per-node statistics: visits, compute invocations, errors and timings. */
public class NodeProfileListener implements StabilizationListener {

    public static class NodeStats {
        public final String name;
        public long visits;
        public long invocations;
        public long errors;
        public long totalDurationNanos;
        public long maxDurationNanos;
        public ComputationState lastState;

        public NodeStats(String name) {
            this.name = name;
        }

        void update(ComputationState state, boolean invoked, long duration) {
            visits++;
            if (invoked)
                invocations++;
            totalDurationNanos += duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
            lastState = state;
        }

        public double avgMicros() {
            return visits == 0 ? 0 : totalDurationNanos / (double) visits / 1000.0;
        }
    }

    private final Map<String, NodeStats> stats = new LinkedHashMap<>();
    private long passes;

    @Override
    public synchronized void onStabilizationStart(OwnerAddress owner, long generation, PassKind kind,
            int scheduled) {
        passes++;
    }

    @Override
    public synchronized void onNodeComputed(long generation, String nodeName, ComputationState state,
            boolean invoked, long durationNanos) {
        stats.computeIfAbsent(nodeName, NodeStats::new).update(state, invoked, durationNanos);
    }

    @Override
    public synchronized void onNodeError(long generation, String nodeName, Throwable error) {
        stats.computeIfAbsent(nodeName, NodeStats::new).errors++;
    }

    @Override
    public void onStabilizationEnd(OwnerAddress owner, long generation, int nodesComputed) {
        // No-op
    }

    /** Number of times {@code nodeName}'s compute function ran or was spawned. */
    public synchronized long invocations(String nodeName) {
        NodeStats s = stats.get(nodeName);
        return s == null ? 0 : s.invocations;
    }

    public synchronized long visits(String nodeName) {
        NodeStats s = stats.get(nodeName);
        return s == null ? 0 : s.visits;
    }

    public synchronized long errors(String nodeName) {
        NodeStats s = stats.get(nodeName);
        return s == null ? 0 : s.errors;
    }

    public synchronized long passes() {
        return passes;
    }

    public synchronized void reset() {
        stats.clear();
        passes = 0;
    }

    /** Formatted table of node statistics, busiest first. */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %8s | %8s | %6s | %10s | %10s%n", "Node Name", "Visits", "Invoked",
                "Errors", "Avg (us)", "Max (us)"));
        sb.append("-------------------------------------------------------------------------------------------\n");

        List<NodeStats> sorted = new ArrayList<>(stats.values());
        sorted.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : sorted) {
            sb.append(String.format("%-30s | %8d | %8d | %6d | %10.2f | %10.2f%n",
                    truncate(s.name, 30),
                    s.visits,
                    s.invocations,
                    s.errors,
                    s.avgMicros(),
                    s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
