package com.viewstate.drg.dsl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiled-ahead description of a view or component: its fields, the props it
 * accepts from a parent, and its node declarations in source order.
 *
 * Instances are immutable and shared by every instance of the same view.
 */
public final class ViewDefinition {
    private final String name;
    private final Map<String, FieldDefinition> fields;
    private final Set<String> props;
    private final List<Declaration> declarations;

    ViewDefinition(String name, List<FieldDefinition> fields, Set<String> props, List<Declaration> declarations) {
        this.name = name;
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        for (FieldDefinition f : fields)
            byName.put(f.name(), f);
        this.fields = Collections.unmodifiableMap(byName);
        this.props = Collections.unmodifiableSet(new LinkedHashSet<>(props));
        this.declarations = List.copyOf(declarations);
    }

    public static ViewBuilder builder(String name) {
        return ViewBuilder.create(name);
    }

    public String name() {
        return name;
    }

    public Map<String, FieldDefinition> fields() {
        return fields;
    }

    public Set<String> props() {
        return props;
    }

    public List<Declaration> declarations() {
        return declarations;
    }

    public boolean isField(String name) {
        return fields.containsKey(name);
    }

    public boolean isProp(String name) {
        return props.contains(name);
    }

    @Override
    public String toString() {
        return "ViewDefinition[" + name + ", fields=" + fields.keySet() + ", props=" + props
                + ", declarations=" + declarations.size() + "]";
    }
}
