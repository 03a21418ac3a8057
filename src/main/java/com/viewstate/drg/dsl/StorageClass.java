package com.viewstate.drg.dsl;

/**
 * Where the field store keeps a field between interactions. The engine ignores
 * this; the store uses it to flag URL or socket state for resynchronization.
 */
public enum StorageClass {
    /** Mirrored in the page URL query string. */
    URL,
    /** Survives a reconnect through client-side sync. */
    SOCKET,
    /** Lives only as long as the owner instance. */
    EPHEMERAL
}
