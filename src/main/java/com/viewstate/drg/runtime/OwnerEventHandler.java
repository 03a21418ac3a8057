package com.viewstate.drg.runtime;

import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that applies {@link OwnerEvent}s to a
 * {@link ViewInstance} and drives its dirty passes.
 *
 * Runs on the single consumer thread of a {@link ViewRuntime}; that thread is
 * the only one that ever touches the instance.
 *
 * Batching:
 * Field writes only mark names dirty. The dirty passes run when the Disruptor
 * reports endOfBatch, or when an event asks for it. A burst of keystrokes
 * therefore costs one pass, not one per write.
 *
 * Commands first flush pending dirty passes, so a query published after a
 * field write observes the write.
 *
 * Failures are logged and never rethrown, to keep the consumer alive.
 */
public final class OwnerEventHandler implements EventHandler<OwnerEvent> {
    private static final Logger log = LogManager.getLogger(OwnerEventHandler.class);

    private final ViewInstance instance;
    private PostStabilizationCallback postStabilize;

    public OwnerEventHandler(ViewInstance instance) {
        this.instance = instance;
    }

    public void setPostStabilizationCallback(PostStabilizationCallback cb) {
        this.postStabilize = cb;
    }

    @Override
    public void onEvent(OwnerEvent event, long sequence, boolean endOfBatch) {
        boolean forceStabilize = event.isBatchEnd();
        try {
            apply(event);
        } catch (Exception e) {
            log.error("Error processing {} for view {}: {}", event, instance.viewId(), e.getMessage(), e);
        } finally {
            event.clear();
        }

        if (forceStabilize || endOfBatch)
            stabilize();
    }

    private void apply(OwnerEvent event) {
        switch (event.type()) {
            case SET_FIELD:
                instance.setField(event.owner(), event.name(), event.value());
                break;
            case MARK_DIRTY:
                instance.markDirty(event.owner(), event.name());
                break;
            case INVALIDATE_RESOURCE:
                instance.markResourceDirty(event.name());
                break;
            case ASYNC_RESULT:
                instance.deliver(event.owner(), event.name(), event.generation(), event.outcome());
                break;
            case COMMAND:
                stabilize();
                event.command().accept(instance);
                break;
            default:
                log.warn("Ignoring empty event in view {}", instance.viewId());
        }
    }

    private void stabilize() {
        try {
            int n = instance.stabilize();
            if (postStabilize != null && n > 0)
                postStabilize.onStabilized(instance, n);
        } catch (Exception e) {
            log.error("Stabilization failed for view {}: {}", instance.viewId(), e.getMessage(), e);
        }
    }

    /**
     * Callback invoked on the consumer thread after a dirty pass computed at
     * least one node.
     */
    @FunctionalInterface
    public interface PostStabilizationCallback {
        void onStabilized(ViewInstance instance, int nodesRecomputed);
    }
}
