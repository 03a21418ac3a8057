package com.viewstate.drg.dsl;

import com.viewstate.drg.api.ComputeFn;
import com.viewstate.drg.api.GraphConfigurationException;

import java.util.*;

/**
 * View Builder -- primary author-facing API.
 *
 * This class provides a fluent API for declaring the fields, props and derived
 * nodes of a view or component.
 *
 * Usage Pattern:
 * 1. Create a builder: ViewBuilder v = ViewDefinition.builder("product_edit");
 * 2. Declare fields: v.field("product_id", FieldType.STRING, StorageClass.URL, null);
 * 3. Declare nodes: v.read("product", "Product", SourceRef.field("product_id"));
 * 4. Build: ViewDefinition def = v.build();
 *
 * Name clashes are rejected as soon as they are declared. Reference resolution
 * and cycle detection happen later, when the definition is compiled into a
 * DependencyGraph.
 */
public final class ViewBuilder {
    private final String viewName;

    private final List<FieldDefinition> fields = new ArrayList<>();
    private final Set<String> props = new LinkedHashSet<>();
    private final List<Declaration> declarations = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    // Flag to prevent modification after building
    private boolean built;

    private ViewBuilder(String viewName) {
        this.viewName = viewName;
    }

    public static ViewBuilder create(String viewName) {
        return new ViewBuilder(viewName);
    }

    // ── Inputs ───────────────────────────────────────────────────

    /** Declares an ephemeral, untyped field. */
    public ViewBuilder field(String name, Object defaultValue) {
        return field(FieldDefinition.ephemeral(name, defaultValue));
    }

    public ViewBuilder field(String name, FieldType type, StorageClass storage, Object defaultValue) {
        return field(new FieldDefinition(name, type, storage, defaultValue));
    }

    public ViewBuilder field(FieldDefinition field) {
        checkNotBuilt();
        claim(field.name());
        fields.add(field);
        return this;
    }

    /** Declares a value supplied by the parent of a component. */
    public ViewBuilder prop(String name) {
        checkNotBuilt();
        claim(name);
        props.add(name);
        return this;
    }

    // ── Derived nodes ────────────────────────────────────────────

    /**
     * Declares a synchronous derived node.
     *
     * @param name Unique name.
     * @param fn   Function of the dependency map.
     * @param deps Dependency references, as accepted by {@link SourceRef#parse}.
     */
    public ViewBuilder derive(String name, ComputeFn fn, String... deps) {
        return declare(new DeriveDeclaration(name, refs(deps), false, fn, Set.of()));
    }

    /** Declares a derived node whose compute runs in a background task. */
    public ViewBuilder deriveAsync(String name, ComputeFn fn, String... deps) {
        return declare(new DeriveDeclaration(name, refs(deps), true, fn, Set.of()));
    }

    /** Loads a record by id, asynchronously, with the default read action. */
    public ViewBuilder read(String name, String resource, SourceRef id) {
        return declare(new ReadDeclaration(name, resource, id));
    }

    /**
     * Declares a form over {@code resource}. When no params reference is given,
     * an ephemeral {@code <name>_params} field holding an empty map is added
     * unless it was declared explicitly.
     */
    public ViewBuilder form(String name, String resource, SourceRef data) {
        return declare(new FormDeclaration(name, resource, data));
    }

    public ViewBuilder declare(Declaration declaration) {
        checkNotBuilt();
        claim(declaration.name());
        declarations.add(declaration);
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    public ViewDefinition build() {
        checkNotBuilt();
        built = true;

        List<FieldDefinition> allFields = new ArrayList<>(fields);
        for (Declaration d : declarations) {
            if (d instanceof FormDeclaration form && form.params() == null) {
                String implicit = form.effectiveParams().name();
                if (!names.contains(implicit)) {
                    names.add(implicit);
                    allFields.add(FieldDefinition.ephemeral(implicit, Map.of()));
                }
            }
        }
        return new ViewDefinition(viewName, allFields, props, declarations);
    }

    // Internal helper to register a name and check for duplicates
    private void claim(String name) {
        if (!names.add(name))
            throw new GraphConfigurationException(name, "Duplicate name in view " + viewName + ": " + name);
    }

    private static List<SourceRef> refs(String... deps) {
        List<SourceRef> out = new ArrayList<>(deps.length);
        for (String d : deps)
            out.add(SourceRef.parse(d));
        return out;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("View already built");
    }
}
