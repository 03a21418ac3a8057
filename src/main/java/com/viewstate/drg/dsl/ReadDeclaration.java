package com.viewstate.drg.dsl;

import java.util.Objects;

/**
 * Loads a single resource record by id.
 *
 * @param name     node name
 * @param resource resource type identifier
 * @param id       where the id comes from
 * @param action   read action, defaults to {@code read}
 * @param async    defaults to true; set false to fetch inline
 */
public record ReadDeclaration(String name, String resource, SourceRef id, String action, boolean async)
        implements Declaration {

    public static final String DEFAULT_ACTION = "read";

    public ReadDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(id, "id");
        action = action == null ? DEFAULT_ACTION : action;
    }

    public ReadDeclaration(String name, String resource, SourceRef id) {
        this(name, resource, id, DEFAULT_ACTION, true);
    }
}
