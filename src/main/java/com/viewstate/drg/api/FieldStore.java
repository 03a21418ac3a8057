package com.viewstate.drg.api;

import java.util.Set;

/**
 * Single source of truth for one owner's field values and node states.
 *
 * The engine never keeps its own copy of a value. It reads dependencies and
 * writes results through this interface, which makes the store the natural
 * synchronization point: it is only ever touched from its owner's thread.
 *
 * Usage Contract:
 * Writing a field with {@link #putField} marks it dirty. Nothing is recomputed
 * until the owner runs a dirty pass, which reads {@link #dirty()} and then calls
 * {@link #clearDirty()}.
 */
public interface FieldStore {

    /** Current value of a field or prop, or null when unset. */
    Object getField(String name);

    /** Whether {@code name} is a known field or prop of this store. */
    boolean hasField(String name);

    /** Updates a field and marks it dirty. */
    void putField(String name, Object value);

    /** Current state of a node, or null before its first pass. */
    ComputationState getNodeState(String name);

    void putNodeState(String name, ComputationState state);

    /** Names changed since the last pass. The returned set is a snapshot. */
    Set<String> dirty();

    void clearDirty();

    void markDirty(String name);
}
