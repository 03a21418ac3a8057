package com.viewstate.drg.resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A create-or-update draft produced by a form node.
 *
 * The draft is CREATE when there is no existing record (or the record carries
 * no id) and UPDATE otherwise. It holds the raw params as submitted; applying
 * and validating them is the resource layer's business.
 *
 * @param resource   the resource type the form edits
 * @param actionType CREATE or UPDATE
 * @param action     the resource action the draft would run
 * @param data       the existing record, or null for CREATE
 * @param params     current form params, never null
 * @param formName   name used to namespace params
 */
public record FormDraft(String resource, ActionType actionType, String action, Object data,
        Map<String, Object> params, String formName) {

    public enum ActionType {
        CREATE, UPDATE
    }

    public FormDraft {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /** Builds the default draft for {@code data} as seen by {@code spec}. */
    public static FormDraft of(String resource, Object data, Map<String, Object> params, FormSpec spec) {
        if (data == null || idOf(data) == null)
            return new FormDraft(resource, ActionType.CREATE, spec.createAction(), null, params, spec.formName());
        return new FormDraft(resource, ActionType.UPDATE, spec.updateAction(), data, params, spec.formName());
    }

    public boolean isCreate() {
        return actionType == ActionType.CREATE;
    }

    private static Object idOf(Object data) {
        if (data instanceof Map<?, ?> m)
            return m.get("id");
        // Non-map records are assumed to be persisted.
        return data;
    }

    /**
     * Names the actions a form uses.
     *
     * @param formName     params namespace
     * @param createAction action for new records
     * @param updateAction action for existing records
     */
    public record FormSpec(String formName, String createAction, String updateAction) {
        public static FormSpec defaults(String formName) {
            return new FormSpec(formName, "create", "update");
        }
    }
}
