package com.viewstate.drg.runtime;

import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.viewstate.drg.api.ComputeOutcome;
import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.api.StabilizationListener;
import com.viewstate.drg.engine.ComputationExecutor;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.util.CompositeStabilizationListener;
import com.viewstate.drg.util.ErrorRateLimiter;

import lombok.extern.log4j.Log4j2;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Actor hosting one {@link ViewInstance}.
 *
 * Every mutation, async completion and query is published into a Disruptor
 * ring buffer and applied by a single consumer thread ({@link OwnerEventHandler}),
 * so the instance never sees concurrent access. Async compute functions run on
 * a separate worker pool; their only way back is an ASYNC_RESULT event.
 *
 * Usage:
 * <pre>
 * try (ViewRuntime rt = new ViewRuntime("v1", graph, ViewRuntimeConfig.load())) {
 *     rt.start();
 *     rt.setField("count", 5);
 *     Object doubled = rt.query(v -&gt; v.state("doubled")).join();
 * }
 * </pre>
 */
@Log4j2
public final class ViewRuntime implements AutoCloseable {
    private final String viewId;
    private final ViewRuntimeConfig config;
    private final ExecutorService workers;
    private final CompositeStabilizationListener listeners = new CompositeStabilizationListener();
    private final ViewInstance instance;
    private final OwnerEventHandler handler;
    private final Disruptor<OwnerEvent> disruptor;

    private RingBuffer<OwnerEvent> ringBuffer;
    private volatile boolean running;

    public ViewRuntime(String viewId, DependencyGraph graph) {
        this(viewId, graph, ViewRuntimeConfig.defaults());
    }

    public ViewRuntime(String viewId, DependencyGraph graph, ViewRuntimeConfig config) {
        if (Integer.bitCount(config.getRingBufferSize()) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2: " + config.getRingBufferSize());
        this.viewId = viewId;
        this.config = config;
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), DaemonThreadFactory.INSTANCE);

        ComputationExecutor executor = new ComputationExecutor(workers, this::publishAsyncResult,
                new ErrorRateLimiter(log, config.getErrorLogIntervalMillis()));
        this.instance = new ViewInstance(viewId, graph, executor, listeners);
        this.handler = new OwnerEventHandler(instance);

        // Async workers publish too, so the ring has multiple producers.
        this.disruptor = new Disruptor<>(
                OwnerEvent::new,
                config.getRingBufferSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                config.getWaitStrategy().create());
        this.disruptor.handleEventsWith(handler);
    }

    // ── Lifecycle ────────────────────────────────────────────────

    /** Starts the consumer and mounts the view with default field values. */
    public ViewRuntime start() {
        return start(Map.of(), Map.of());
    }

    /** Starts the consumer and mounts the view, hydrating URL and socket fields. */
    public ViewRuntime start(Map<String, String> urlParams, Map<String, String> connectParams) {
        if (running)
            throw new IllegalStateException("Runtime for view " + viewId + " already started");
        ringBuffer = disruptor.start();
        running = true;
        execute(v -> v.mount(urlParams, connectParams));
        log.info("Started runtime for view {} (ring={}, workers={}, wait={})", viewId,
                config.getRingBufferSize(), config.getWorkerThreads(), config.getWaitStrategy());
        return this;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        if (!running) {
            // Never started, or already closed: only the worker pool may be left.
            workers.shutdownNow();
            return;
        }
        running = false;
        try {
            disruptor.shutdown(config.getShutdownTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Runtime for view {} did not drain within {} ms, halting", viewId,
                    config.getShutdownTimeoutMillis());
            disruptor.halt();
        }
        workers.shutdownNow();
        log.info("Stopped runtime for view {}", viewId);
    }

    // ── Observation ──────────────────────────────────────────────

    /** Adds a listener for every pass of the view and its components. */
    public void addListener(StabilizationListener listener) {
        listeners.add(listener);
    }

    /** Must be set before {@link #start()}. */
    public void setPostStabilizationCallback(OwnerEventHandler.PostStabilizationCallback cb) {
        handler.setPostStabilizationCallback(cb);
    }

    // ── Publishing ───────────────────────────────────────────────

    public void setField(String name, Object value) {
        setField(OwnerAddress.view(viewId), name, value, false);
    }

    public void setField(OwnerAddress owner, String name, Object value) {
        setField(owner, name, value, false);
    }

    /**
     * @param batchEnd run the dirty pass right after this write even if more
     *                 events are queued
     */
    public void setField(OwnerAddress owner, String name, Object value, boolean batchEnd) {
        long seq = claim();
        try {
            ringBuffer.get(seq).setFieldUpdate(owner, name, value, batchEnd);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    public void markDirty(OwnerAddress owner, String name) {
        long seq = claim();
        try {
            ringBuffer.get(seq).setMarkDirty(owner, name);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    /** Recomputes every node of the view and its components that reads {@code resource}. */
    public void invalidateResource(String resource) {
        long seq = claim();
        try {
            ringBuffer.get(seq).setResourceInvalidation(resource);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    public CompletableFuture<Integer> mountComponent(String componentId, DependencyGraph graph, Map<String, ?> props) {
        return query(v -> v.mountComponent(componentId, graph, props));
    }

    public CompletableFuture<Integer> updateProps(String componentId, Map<String, ?> props) {
        return query(v -> v.updateProps(componentId, props));
    }

    public CompletableFuture<Boolean> unmountComponent(String componentId) {
        return query(v -> v.unmountComponent(componentId));
    }

    /**
     * Runs {@code fn} on the consumer thread after pending writes have been
     * stabilized.
     */
    public <T> CompletableFuture<T> query(Function<ViewInstance, T> fn) {
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(v -> {
            try {
                result.complete(fn.apply(v));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private void execute(Consumer<ViewInstance> command) {
        long seq = claim();
        try {
            ringBuffer.get(seq).setCommand(command);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    // Called from worker threads.
    private void publishAsyncResult(OwnerAddress owner, String nodeName, long generation, ComputeOutcome outcome) {
        if (!running) {
            log.debug("Runtime for view {} stopped, dropping result of {}", viewId, nodeName);
            return;
        }
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).setAsyncResult(owner, nodeName, generation, outcome);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    private long claim() {
        if (!running)
            throw new IllegalStateException("Runtime for view " + viewId + " is not running");
        return ringBuffer.next();
    }

    public String viewId() {
        return viewId;
    }

    boolean isWorkerPoolShutdown() {
        return workers.isShutdown();
    }
}
