package com.viewstate.drg.dsl;

import java.util.Objects;

/**
 * A reference to where a dependency value comes from.
 *
 * Declarations name their inputs in one of three shapes: a field, another
 * node's result, or a prop supplied by the caller. All three resolve to a bare
 * name in the built node; the shape is only checked against the view
 * definition at build time. A reference of kind {@link Kind#ANY} (a bare name)
 * matches whichever of the three exists.
 *
 * @param kind declared shape
 * @param name the referenced name
 */
public record SourceRef(Kind kind, String name) {

    public enum Kind {
        FIELD, RESULT, PROP, ANY
    }

    public SourceRef {
        Objects.requireNonNull(kind, "kind");
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Source reference needs a name");
    }

    public static SourceRef field(String name) {
        return new SourceRef(Kind.FIELD, name);
    }

    public static SourceRef result(String name) {
        return new SourceRef(Kind.RESULT, name);
    }

    public static SourceRef prop(String name) {
        return new SourceRef(Kind.PROP, name);
    }

    public static SourceRef of(String name) {
        return new SourceRef(Kind.ANY, name);
    }

    /**
     * Parses {@code field:x}, {@code result:x}, {@code prop:x} or a bare
     * {@code x}. Returns null for null input so optional references stay
     * optional.
     */
    public static SourceRef parse(String text) {
        if (text == null)
            return null;
        int colon = text.indexOf(':');
        if (colon < 0)
            return of(text.trim());
        String prefix = text.substring(0, colon).trim();
        String name = text.substring(colon + 1).trim();
        switch (prefix) {
            case "field":
            case "input":
                return field(name);
            case "result":
                return result(name);
            case "prop":
                return prop(name);
            default:
                throw new IllegalArgumentException("Unknown source reference kind '" + prefix + "' in " + text);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.ANY ? name : kind.name().toLowerCase() + ":" + name;
    }
}
