package com.viewstate.drg.api;

import java.util.Map;

/**
 * The computation behind a node.
 *
 * Receives the current dependency values keyed by dependency name. Values are
 * always plain: Ready wrappers are removed before the call. The function may
 * throw; the executor turns any exception into a Failed state.
 */
@FunctionalInterface
public interface ComputeFn {
    Object compute(Map<String, Object> deps) throws Exception;
}
