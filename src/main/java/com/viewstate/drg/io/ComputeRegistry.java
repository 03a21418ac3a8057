package com.viewstate.drg.io;

import com.viewstate.drg.api.ComputeFn;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping the function names used in JSON definitions to
 * {@link ComputeFn}s.
 */
public final class ComputeRegistry {
    private final Map<String, ComputeFn> functions = new HashMap<>();

    /**
     * @throws IllegalArgumentException if {@code name} is already registered
     */
    public ComputeRegistry register(String name, ComputeFn fn) {
        if (functions.putIfAbsent(name, fn) != null)
            throw new IllegalArgumentException("Compute function already registered: " + name);
        return this;
    }

    /** The function registered under {@code name}, or null. */
    public ComputeFn get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    // ── Built-in Functions ──────────────────────────────────────────

    /**
     * Registers single-argument helpers:
     * {@code identity} (the value), {@code not} (boolean negation, null is false)
     * and {@code present} (value is not null).
     */
    public ComputeRegistry registerBuiltIns() {
        register("identity", ComputeRegistry::first);
        register("not", deps -> !Boolean.TRUE.equals(first(deps)));
        register("present", deps -> first(deps) != null);
        return this;
    }

    private static Object first(Map<String, Object> deps) {
        Iterator<Object> it = deps.values().iterator();
        if (!it.hasNext())
            throw new IllegalArgumentException("Function needs one argument");
        return it.next();
    }
}
