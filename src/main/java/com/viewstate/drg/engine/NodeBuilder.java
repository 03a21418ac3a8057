package com.viewstate.drg.engine;

import com.viewstate.drg.api.GraphConfigurationException;
import com.viewstate.drg.api.Node;
import com.viewstate.drg.dsl.*;
import com.viewstate.drg.resource.FormDraft;
import com.viewstate.drg.resource.ResourceGateway;

import java.util.*;

/**
 * Expands every declaration of a view into the uniform {@link Node} shape.
 *
 * Derive declarations map one to one. Read and form declarations are rewritten
 * into nodes whose compute function calls the {@link ResourceGateway}:
 *
 * - read: depends on the id source; async unless disabled; a null id yields
 * null without touching the gateway, and a missing record also yields null.
 * - form: depends on the optional data source and the params source; always
 * sync; builds a create-or-update draft.
 *
 * All three reference shapes (field, result, prop) are resolved to bare names
 * here. A reference that names nothing in the view is a configuration error.
 */
public final class NodeBuilder {
    private final ResourceGateway gateway;

    public NodeBuilder(ResourceGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    /**
     * @return one node per declaration, in declaration order
     * @throws GraphConfigurationException on an unresolvable reference
     */
    public List<Node> build(ViewDefinition view) {
        Set<String> nodeNames = new HashSet<>();
        for (Declaration d : view.declarations())
            nodeNames.add(d.name());

        Resolver resolver = new Resolver(view, nodeNames);
        List<Node> nodes = new ArrayList<>(view.declarations().size());
        for (Declaration d : view.declarations())
            nodes.add(expand(d, resolver));
        return nodes;
    }

    private Node expand(Declaration d, Resolver resolver) {
        if (d instanceof DeriveDeclaration derive)
            return expandDerive(derive, resolver);
        if (d instanceof ReadDeclaration read)
            return expandRead(read, resolver);
        if (d instanceof FormDeclaration form)
            return expandForm(form, resolver);
        throw new GraphConfigurationException(d.name(),
                "Unsupported declaration kind " + d.getClass().getSimpleName() + " for " + d.name());
    }

    private Node expandDerive(DeriveDeclaration derive, Resolver resolver) {
        List<String> deps = new ArrayList<>(derive.arguments().size());
        for (SourceRef ref : derive.arguments())
            deps.add(resolver.resolve(derive.name(), ref));
        return new Node(derive.name(), deps, derive.async(), derive.compute(), derive.reads());
    }

    private Node expandRead(ReadDeclaration read, Resolver resolver) {
        final String idDep = resolver.resolve(read.name(), read.id());
        final String resource = read.resource();
        final String action = read.action();

        return new Node(read.name(), List.of(idDep), read.async(), deps -> {
            Object id = deps.get(idDep);
            if (id == null)
                return null;
            Optional<?> record = gateway.fetchById(resource, id, action);
            return record.orElse(null);
        }, Set.of(resource));
    }

    private Node expandForm(FormDeclaration form, Resolver resolver) {
        final String dataDep = form.data() == null ? null : resolver.resolve(form.name(), form.data());
        final String paramsDep = resolver.resolve(form.name(), form.effectiveParams());
        final String resource = form.resource();
        final FormDraft.FormSpec spec = new FormDraft.FormSpec(form.name(), form.createAction(),
                form.updateAction());

        List<String> deps = dataDep == null ? List.of(paramsDep) : List.of(dataDep, paramsDep);
        return new Node(form.name(), deps, false, values -> {
            Map<String, Object> params = asParams(form.name(), values.get(paramsDep));
            Object data = dataDep == null ? null : values.get(dataDep);
            return gateway.buildDraft(resource, data, params, spec);
        }, Set.of(resource));
    }

    private static Map<String, Object> asParams(String formName, Object raw) {
        if (raw == null)
            return Map.of();
        if (!(raw instanceof Map<?, ?> m))
            throw new IllegalArgumentException("Params of form " + formName + " must be a map, got "
                    + raw.getClass().getSimpleName());
        Map<String, Object> params = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet())
            params.put(String.valueOf(e.getKey()), e.getValue());
        return params;
    }

    /** Resolves references against one view's fields, props and nodes. */
    private static final class Resolver {
        private final ViewDefinition view;
        private final Set<String> nodeNames;

        Resolver(ViewDefinition view, Set<String> nodeNames) {
            this.view = view;
            this.nodeNames = nodeNames;
        }

        String resolve(String owner, SourceRef ref) {
            String name = ref.name();
            boolean ok;
            switch (ref.kind()) {
                case FIELD:
                    ok = view.isField(name);
                    break;
                case PROP:
                    ok = view.isProp(name);
                    break;
                case RESULT:
                    ok = nodeNames.contains(name);
                    break;
                default:
                    ok = view.isField(name) || view.isProp(name) || nodeNames.contains(name);
            }
            if (!ok)
                throw new GraphConfigurationException(owner,
                        "Node " + owner + " references " + ref + ", which is not defined in view " + view.name());
            return name;
        }
    }
}
