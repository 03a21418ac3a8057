package com.viewstate.drg.api;

/**
 * Thrown while building a graph from declarations: an unresolvable dependency
 * reference, a duplicate name, or a dependency cycle.
 *
 * These are programming errors in a view definition and surface when the
 * definition is compiled, never during a pass.
 */
public class GraphConfigurationException extends IllegalStateException {
    private final String offendingName;

    public GraphConfigurationException(String offendingName, String message) {
        super(message);
        this.offendingName = offendingName;
    }

    /** The node or name the diagnostic is about. */
    public String offendingName() {
        return offendingName;
    }
}
