package com.viewstate.drg.resource;

import java.util.Map;
import java.util.Optional;

/**
 * The external data-access layer called from expanded read and form nodes.
 *
 * The graph engine does not implement this. A read node calls
 * {@link #fetchById} on a worker thread; a form node calls
 * {@link #buildDraft} inline on the owner thread.
 */
public interface ResourceGateway {

    /**
     * Loads one record.
     *
     * @param resource resource type identifier
     * @param id       record id, never null
     * @param action   the read action to run
     * @return the record, or empty when it does not exist
     * @throws Exception any other failure; the node becomes Failed
     */
    Optional<?> fetchById(String resource, Object id, String action) throws Exception;

    /**
     * Builds a create-or-update draft. The default returns a {@link FormDraft}.
     *
     * @param resource resource type identifier
     * @param existing the loaded record, or null
     * @param params   current form params, never null
     * @param spec     the form's name and actions
     */
    default Object buildDraft(String resource, Object existing, Map<String, Object> params,
            FormDraft.FormSpec spec) throws Exception {
        return FormDraft.of(resource, existing, params, spec);
    }

    /** A gateway with no records. Reads of any id resolve to null. */
    static ResourceGateway empty() {
        return (resource, id, action) -> Optional.empty();
    }
}
