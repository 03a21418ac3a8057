package com.viewstate.drg.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.viewstate.drg.api.ComputeFn;
import com.viewstate.drg.api.GraphConfigurationException;
import com.viewstate.drg.dsl.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Compiles a JSON {@link ViewDocument} into a {@link ViewDefinition}.
 *
 * Declarations are added in a fixed order: derives, then reads, then forms.
 * Order does not affect scheduling, only the tie-break between nodes of equal
 * depth. Named compute functions come from the {@link ComputeRegistry}.
 */
public final class JsonViewCompiler {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ComputeRegistry registry;

    public JsonViewCompiler() {
        this(new ComputeRegistry().registerBuiltIns());
    }

    public JsonViewCompiler(ComputeRegistry registry) {
        this.registry = registry;
    }

    public JsonViewCompiler register(String name, ComputeFn fn) {
        registry.register(name, fn);
        return this;
    }

    // ── Parsing ──────────────────────────────────────────────────

    public static ViewDocument parse(String json) throws IOException {
        return MAPPER.readValue(json, ViewDocument.class);
    }

    public static ViewDocument parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a document from the classpath. */
    public static ViewDocument parseResource(String resource) throws IOException {
        try (InputStream in = JsonViewCompiler.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return MAPPER.readValue(in, ViewDocument.class);
        }
    }

    // ── Compilation ──────────────────────────────────────────────

    public ViewDefinition compile(String json) throws IOException {
        return compile(parse(json));
    }

    /**
     * @throws GraphConfigurationException on a missing name, an unknown compute
     *                                     function or an invalid field definition
     */
    public ViewDefinition compile(ViewDocument doc) {
        ViewDocument.ViewInfo info = doc.getView();
        if (info == null || info.getName() == null)
            throw new GraphConfigurationException(null, "View document needs a 'view' object with a name");

        ViewBuilder b = ViewDefinition.builder(info.getName());

        for (ViewDocument.FieldDef f : nullSafe(info.getFields()))
            b.field(toField(f));
        for (String p : nullSafe(info.getProps()))
            b.prop(p);

        for (ViewDocument.DeriveDef d : nullSafe(info.getDerive())) {
            requireName("derive", d.getName());
            ComputeFn fn = d.getFn() == null ? null : registry.get(d.getFn());
            if (fn == null)
                throw new GraphConfigurationException(d.getName(),
                        "No compute function '" + d.getFn() + "' for node " + d.getName());
            List<SourceRef> args = new ArrayList<>();
            for (String a : nullSafe(d.getArguments()))
                args.add(ref(d.getName(), a));
            Set<String> reads = new LinkedHashSet<>(nullSafe(d.getReads()));
            b.declare(new DeriveDeclaration(d.getName(), args, d.isAsync(), fn, reads));
        }

        for (ViewDocument.ReadDef r : nullSafe(info.getReads())) {
            String name = requireName("read", r.getName());
            boolean async = r.getAsync() == null || r.getAsync();
            b.declare(new ReadDeclaration(name, require(name, "resource", r.getResource()),
                    require(name, "id", ref(name, r.getId())), r.getAction(), async));
        }

        for (ViewDocument.FormDef f : nullSafe(info.getForms())) {
            String name = requireName("form", f.getName());
            b.declare(new FormDeclaration(name, require(name, "resource", f.getResource()), ref(name, f.getData()),
                    ref(name, f.getParams()), f.getCreateAction(), f.getUpdateAction()));
        }

        return b.build();
    }

    private static FieldDefinition toField(ViewDocument.FieldDef f) {
        requireName("field", f.getName());
        FieldType type = enumValue(FieldType.class, f.getType(), FieldType.OBJECT, f.getName());
        StorageClass storage = enumValue(StorageClass.class, f.getStorage(), StorageClass.EPHEMERAL, f.getName());
        return new FieldDefinition(f.getName(), type, storage, coerceDefault(type, f.getDefaultValue(), f.getName()));
    }

    // JSON numbers arrive as Integer or Double; fields hold Long and Double.
    private static Object coerceDefault(FieldType type, Object value, String field) {
        if (value == null)
            return null;
        try {
            switch (type) {
                case INTEGER:
                    return value instanceof Number n ? (Object) n.longValue() : type.parse(value.toString());
                case FLOAT:
                    return value instanceof Number n ? (Object) n.doubleValue() : type.parse(value.toString());
                case BOOLEAN:
                    return value instanceof Boolean ? value : type.parse(value.toString());
                case STRING:
                    return value.toString();
                default:
                    return value;
            }
        } catch (IllegalArgumentException e) {
            throw new GraphConfigurationException(field, "Invalid default for field " + field + ": " + e.getMessage());
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String text, E def, String field) {
        if (text == null)
            return def;
        try {
            return Enum.valueOf(type, text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GraphConfigurationException(field,
                    "Unknown " + type.getSimpleName() + " '" + text + "' for field " + field);
        }
    }

    private static <T> T require(String node, String what, T value) {
        if (value == null)
            throw new GraphConfigurationException(node, "Node " + node + " needs '" + what + "'");
        return value;
    }

    private static String requireName(String entry, String name) {
        if (name == null || name.isBlank())
            throw new GraphConfigurationException(null, "A " + entry + " entry needs a 'name'");
        return name;
    }

    private static SourceRef ref(String node, String text) {
        try {
            return SourceRef.parse(text);
        } catch (IllegalArgumentException e) {
            throw new GraphConfigurationException(node, "Node " + node + ": " + e.getMessage());
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
