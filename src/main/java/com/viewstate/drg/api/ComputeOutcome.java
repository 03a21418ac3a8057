package com.viewstate.drg.api;

import java.util.Map;

/**
 * Explicit result of one compute invocation: {@link Ok} or {@link Err}.
 *
 * Every call into a {@link ComputeFn} goes through {@link #capture}, so a
 * throwing compute function always ends up as data rather than unwinding the
 * owner thread.
 */
public interface ComputeOutcome {

    static ComputeOutcome ok(Object value) {
        return new Ok(value);
    }

    static ComputeOutcome err(Throwable cause) {
        return new Err(cause);
    }

    /**
     * Runs {@code fn} and captures anything it throws, errors included. Only a
     * {@link VirtualMachineError} other than stack overflow is rethrown.
     */
    static ComputeOutcome capture(ComputeFn fn, Map<String, Object> deps) {
        try {
            return new Ok(fn.compute(deps));
        } catch (StackOverflowError e) {
            return new Err(e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            return new Err(t);
        }
    }

    /**
     * Converts this outcome into the state stored for its node.
     *
     * @param async marks a Ready value as coming from async data
     */
    ComputationState toState(boolean async);

    record Ok(Object value) implements ComputeOutcome {
        @Override
        public ComputationState toState(boolean async) {
            return new ComputationState.Ready(value, async);
        }
    }

    record Err(Throwable cause) implements ComputeOutcome {
        @Override
        public ComputationState toState(boolean async) {
            return ComputationState.failed(cause);
        }
    }
}
