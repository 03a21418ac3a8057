package com.viewstate.drg.api;

import java.util.Objects;

/**
 * Tri-state result stored per node: {@link Ready}, {@link Loading} or
 * {@link Failed}.
 *
 * A node has no state at all until its first pass. Sync nodes then go straight
 * to Ready or Failed; async nodes go through Loading first. Every later pass
 * simply overwrites the stored state.
 *
 * Ready carries an {@code async} marker. It is set when the value came from an
 * async task, or when a sync node computed it from at least one such value. An
 * observer that only understands "async or not" still sees that the value
 * depends on background data.
 */
public interface ComputationState {

    static Ready ready(Object value) {
        return new Ready(value, false);
    }

    static Ready readyAsync(Object value) {
        return new Ready(value, true);
    }

    static Loading loading() {
        return Loading.INSTANCE;
    }

    static Failed failed(String reason) {
        return new Failed(reason, null);
    }

    static Failed failed(Throwable cause) {
        return new Failed(Failed.reasonOf(cause), cause);
    }

    default boolean isReady() {
        return this instanceof Ready;
    }

    default boolean isLoading() {
        return this instanceof Loading;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /** A computed value. */
    record Ready(Object value, boolean async) implements ComputationState {
        @Override
        public String toString() {
            return (async ? "Ready~(" : "Ready(") + value + ")";
        }
    }

    /** An async computation is in flight, here or upstream. */
    final class Loading implements ComputationState {
        static final Loading INSTANCE = new Loading();

        private Loading() {
        }

        @Override
        public String toString() {
            return "Loading";
        }
    }

    /**
     * The computation, or one of its dependencies, failed.
     * Equality is by reason only; the cause is diagnostic.
     */
    record Failed(String reason, Throwable cause) implements ComputationState {

        static String reasonOf(Throwable t) {
            return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Failed f && Objects.equals(reason, f.reason);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(reason);
        }

        @Override
        public String toString() {
            return "Failed(" + reason + ")";
        }
    }
}
