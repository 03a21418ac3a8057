package com.viewstate.drg.dsl;

import com.viewstate.drg.api.ComputeFn;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A plain derived expression with explicit dependencies.
 *
 * @param name      node name
 * @param arguments dependency references, in the order compute sees them
 * @param async     whether compute runs in a background task
 * @param compute   the computation
 * @param reads     external resources compute reads, for invalidation only
 */
public record DeriveDeclaration(String name, List<SourceRef> arguments, boolean async, ComputeFn compute,
        Set<String> reads) implements Declaration {

    public DeriveDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(compute, "compute");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        reads = reads == null ? Set.of() : Set.copyOf(reads);
    }
}
