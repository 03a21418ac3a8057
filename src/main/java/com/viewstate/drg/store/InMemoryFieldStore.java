package com.viewstate.drg.store;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.FieldStore;
import com.viewstate.drg.dsl.FieldDefinition;
import com.viewstate.drg.dsl.StorageClass;
import com.viewstate.drg.dsl.ViewDefinition;

import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * Per-owner field and node-state storage.
 *
 * Fields start at their declared defaults; props start unset (null). Every
 * field write marks the name dirty. Writes to URL or socket fields also raise
 * a changed flag, which the owner clears after syncing that storage.
 *
 * Prop writes only mark a prop dirty when its value actually changed, so a
 * parent re-render with identical props does not cascade into the component.
 *
 * Not thread safe; owned by one actor.
 */
@Log4j2
public final class InMemoryFieldStore implements FieldStore {
    private final Map<String, FieldDefinition> definitions;
    private final Set<String> props;

    private final Map<String, Object> values = new HashMap<>();
    private final Map<String, ComputationState> nodeStates = new LinkedHashMap<>();
    private final Set<String> dirty = new LinkedHashSet<>();

    private boolean urlChanged;
    private boolean socketChanged;

    public InMemoryFieldStore(ViewDefinition view) {
        this.definitions = view.fields();
        this.props = view.props();
        for (FieldDefinition f : definitions.values())
            values.put(f.name(), f.defaultValue());
        for (String p : props)
            values.put(p, null);
    }

    // ── Fields ───────────────────────────────────────────────────

    @Override
    public Object getField(String name) {
        return values.get(name);
    }

    @Override
    public boolean hasField(String name) {
        return definitions.containsKey(name) || props.contains(name);
    }

    @Override
    public void putField(String name, Object value) {
        FieldDefinition def = definitions.get(name);
        if (def == null) {
            if (props.contains(name))
                throw new IllegalArgumentException("Prop " + name + " is owned by the parent; use putProp");
            throw new IllegalArgumentException("Unknown field: " + name);
        }
        Object old = values.put(name, value);
        dirty.add(name);
        if (!Objects.equals(old, value)) {
            if (def.storage() == StorageClass.URL)
                urlChanged = true;
            else if (def.storage() == StorageClass.SOCKET)
                socketChanged = true;
        }
    }

    /**
     * Stores a prop value from the parent.
     *
     * @return true if the value changed and the prop was marked dirty
     */
    public boolean putProp(String name, Object value) {
        if (!props.contains(name))
            throw new IllegalArgumentException("Unknown prop: " + name);
        Object old = values.put(name, value);
        if (Objects.equals(old, value))
            return false;
        dirty.add(name);
        return true;
    }

    /**
     * Loads fields of one storage class from their string form. Absent keys fall
     * back to the default; unparseable values are logged and also fall back.
     * Nothing is marked dirty: hydration precedes a full pass.
     */
    public void hydrate(StorageClass storage, Map<String, String> raw) {
        for (FieldDefinition f : definitions.values()) {
            if (f.storage() != storage)
                continue;
            String text = raw.get(f.name());
            if (text == null) {
                values.put(f.name(), f.defaultValue());
                continue;
            }
            try {
                values.put(f.name(), f.type().parse(text));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring {} value for field {}: {}", storage, f.name(), e.getMessage());
                values.put(f.name(), f.defaultValue());
            }
        }
    }

    /**
     * String form of the fields of one storage class that differ from their
     * defaults, for writing back to the URL or connect params.
     */
    public Map<String, String> dump(StorageClass storage) {
        Map<String, String> out = new LinkedHashMap<>();
        for (FieldDefinition f : definitions.values()) {
            if (f.storage() != storage)
                continue;
            Object v = values.get(f.name());
            if (v != null && !Objects.equals(v, f.defaultValue()))
                out.put(f.name(), f.type().dump(v));
        }
        return out;
    }

    // ── Node states ──────────────────────────────────────────────

    @Override
    public ComputationState getNodeState(String name) {
        return nodeStates.get(name);
    }

    @Override
    public void putNodeState(String name, ComputationState state) {
        nodeStates.put(name, Objects.requireNonNull(state, "state"));
    }

    /** Copy of all node states, in first-write order. */
    public Map<String, ComputationState> nodeStates() {
        return new LinkedHashMap<>(nodeStates);
    }

    // ── Dirty tracking ───────────────────────────────────────────

    @Override
    public Set<String> dirty() {
        return new LinkedHashSet<>(dirty);
    }

    @Override
    public void clearDirty() {
        dirty.clear();
    }

    @Override
    public void markDirty(String name) {
        dirty.add(name);
    }

    public boolean isUrlChanged() {
        return urlChanged;
    }

    public void clearUrlChanged() {
        urlChanged = false;
    }

    public boolean isSocketChanged() {
        return socketChanged;
    }

    public void clearSocketChanged() {
        socketChanged = false;
    }
}
