package com.viewstate.drg.api;

/** What triggered a stabilization pass. */
public enum PassKind {
    /** Mount or explicit recompute of every node. */
    FULL,
    /** Nodes affected by the owner's dirty set. */
    DIRTY,
    /** Dependents of a node whose async result just arrived. */
    DEPENDENTS
}
