package com.viewstate.drg.dsl;

import java.util.Objects;

/**
 * Builds a create-or-update draft for a resource from the current params and,
 * when given, an existing record.
 *
 * @param name         node name
 * @param resource     resource type identifier
 * @param data         where the existing record comes from, or null
 * @param params       where the params come from; null means the field
 *                     {@code <name>_params}
 * @param createAction defaults to {@code create}
 * @param updateAction defaults to {@code update}
 */
public record FormDeclaration(String name, String resource, SourceRef data, SourceRef params,
        String createAction, String updateAction) implements Declaration {

    public FormDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(resource, "resource");
        createAction = createAction == null ? "create" : createAction;
        updateAction = updateAction == null ? "update" : updateAction;
    }

    public FormDeclaration(String name, String resource, SourceRef data) {
        this(name, resource, data, null, null, null);
    }

    /** The params reference, with the implicit default applied. */
    public SourceRef effectiveParams() {
        return params != null ? params : SourceRef.field(name + "_params");
    }
}
