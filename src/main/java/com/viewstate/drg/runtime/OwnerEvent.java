package com.viewstate.drg.runtime;

import com.viewstate.drg.api.ComputeOutcome;
import com.viewstate.drg.api.OwnerAddress;

import java.util.function.Consumer;

/**
 * Mutable message slot in a view's ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 * Slots are pre-allocated with the ring buffer and reused. Producers fill a
 * slot through one of the setters, the consumer applies it and then clears it
 * so no payload stays reachable from the ring.
 *
 * batchEnd forces the pending dirty passes to run right after this event even
 * when more events are queued.
 */
public final class OwnerEvent {

    public enum Type {
        NONE,
        /** Write a field of an owner. */
        SET_FIELD,
        /** Mark a field or node dirty without changing it. */
        MARK_DIRTY,
        /** Mark every reader of a resource dirty. */
        INVALIDATE_RESOURCE,
        /** Deliver a finished async computation. */
        ASYNC_RESULT,
        /** Run arbitrary work against the instance (mounts, props, queries). */
        COMMAND
    }

    private Type type = Type.NONE;
    private OwnerAddress owner;
    private String name;
    private Object value;
    private long generation;
    private ComputeOutcome outcome;
    private Consumer<ViewInstance> command;
    private boolean batchEnd;

    public void setFieldUpdate(OwnerAddress owner, String name, Object value, boolean batchEnd) {
        this.type = Type.SET_FIELD;
        this.owner = owner;
        this.name = name;
        this.value = value;
        this.batchEnd = batchEnd;
    }

    public void setMarkDirty(OwnerAddress owner, String name) {
        this.type = Type.MARK_DIRTY;
        this.owner = owner;
        this.name = name;
    }

    public void setResourceInvalidation(String resource) {
        this.type = Type.INVALIDATE_RESOURCE;
        this.name = resource;
    }

    public void setAsyncResult(OwnerAddress owner, String nodeName, long generation, ComputeOutcome outcome) {
        this.type = Type.ASYNC_RESULT;
        this.owner = owner;
        this.name = nodeName;
        this.generation = generation;
        this.outcome = outcome;
    }

    public void setCommand(Consumer<ViewInstance> command) {
        this.type = Type.COMMAND;
        this.command = command;
    }

    public Type type() {
        return type;
    }

    public OwnerAddress owner() {
        return owner;
    }

    public String name() {
        return name;
    }

    public Object value() {
        return value;
    }

    public long generation() {
        return generation;
    }

    public ComputeOutcome outcome() {
        return outcome;
    }

    public Consumer<ViewInstance> command() {
        return command;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public void clear() {
        type = Type.NONE;
        owner = null;
        name = null;
        value = null;
        generation = 0;
        outcome = null;
        command = null;
        batchEnd = false;
    }

    @Override
    public String toString() {
        return "OwnerEvent[" + type + ", owner=" + owner + ", name=" + name + "]";
    }
}
