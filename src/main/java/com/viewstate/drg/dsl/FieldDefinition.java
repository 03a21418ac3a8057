package com.viewstate.drg.dsl;

import java.util.Objects;

/**
 * A named, typed, mutable input of a view or component.
 *
 * @param name         unique within the owner
 * @param type         value type, used for string hydration
 * @param storage      where the store keeps it
 * @param defaultValue initial value
 */
public record FieldDefinition(String name, FieldType type, StorageClass storage, Object defaultValue) {

    public FieldDefinition {
        Objects.requireNonNull(name, "name");
        type = type == null ? FieldType.OBJECT : type;
        storage = storage == null ? StorageClass.EPHEMERAL : storage;
    }

    public static FieldDefinition ephemeral(String name, Object defaultValue) {
        return new FieldDefinition(name, FieldType.OBJECT, StorageClass.EPHEMERAL, defaultValue);
    }
}
