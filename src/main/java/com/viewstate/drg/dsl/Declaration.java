package com.viewstate.drg.dsl;

/**
 * A declarative source of a derived node.
 *
 * Exactly three kinds exist: {@link DeriveDeclaration},
 * {@link ReadDeclaration} and {@link FormDeclaration}. The NodeBuilder expands
 * each of them into the same Node shape.
 */
public interface Declaration {

    /** Name of the node this declaration produces. */
    String name();
}
