package com.viewstate.drg.api;

import java.util.Objects;

/**
 * Identifies the owner that spawned an async task: a top-level view, or a
 * component instance nested inside that view.
 *
 * Component instances cannot be reached directly by a finished background task.
 * The address is captured when the task is spawned and carried back with its
 * result so the router can find the right store.
 *
 * @param viewId      the top-level view instance
 * @param componentId the nested component instance, or null for the view itself
 */
public record OwnerAddress(String viewId, String componentId) {

    public OwnerAddress {
        Objects.requireNonNull(viewId, "viewId");
    }

    public static OwnerAddress view(String viewId) {
        return new OwnerAddress(viewId, null);
    }

    public static OwnerAddress component(String viewId, String componentId) {
        return new OwnerAddress(viewId, Objects.requireNonNull(componentId, "componentId"));
    }

    public boolean isComponent() {
        return componentId != null;
    }

    @Override
    public String toString() {
        return componentId == null ? viewId : viewId + "/" + componentId;
    }
}
