package com.viewstate.drg;

import com.viewstate.drg.dsl.ViewBuilder;
import com.viewstate.drg.dsl.ViewDefinition;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.io.JsonViewCompiler;
import com.viewstate.drg.resource.ResourceGateway;
import com.viewstate.drg.runtime.ViewRuntime;
import com.viewstate.drg.runtime.ViewRuntimeConfig;

import java.io.IOException;
import java.nio.file.Path;

/**
 * ViewGraph: reactive dependency graph for server-held view state.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Fields</b> are the mutable inputs of a view or component; <b>props</b>
 * are inputs owned by a parent.</li>
 * <li><b>Nodes</b> are derived values: plain derivations, resource reads by id,
 * and create-or-update form drafts. Each node is Ready, Loading or Failed.</li>
 * <li>Writing a field recomputes exactly the nodes downstream of it, once each,
 * in dependency order. Async nodes report Loading until their result is
 * delivered back to the owner that launched them.</li>
 * </ul>
 *
 * <h3>Typical wiring</h3>
 * <pre>
 * ViewDefinition def = ViewGraph.builder("counter")
 *         .field("count", 0L)
 *         .derive("doubled", d -&gt; (Long) d.get("count") * 2, "field:count")
 *         .build();
 * DependencyGraph graph = ViewGraph.compile(def, ResourceGateway.empty());
 * ViewRuntime rt = ViewGraph.runtime("counter-1", graph).start();
 * </pre>
 */
public final class ViewGraph {

    private ViewGraph() {
        // Prevent instantiation of utility class
    }

    /** Entry point: a fluent builder for a view or component definition. */
    public static ViewBuilder builder(String viewName) {
        return ViewBuilder.create(viewName);
    }

    /**
     * Validates and compiles a definition.
     *
     * @throws com.viewstate.drg.api.GraphConfigurationException if a reference is
     *                                                           unresolvable or
     *                                                           the graph has a
     *                                                           cycle
     */
    public static DependencyGraph compile(ViewDefinition definition, ResourceGateway gateway) {
        return DependencyGraph.compile(definition, gateway);
    }

    /** Reads and compiles a JSON view definition with the built-in compute functions. */
    public static DependencyGraph compileJson(Path jsonPath, ResourceGateway gateway) throws IOException {
        ViewDefinition def = new JsonViewCompiler().compile(JsonViewCompiler.parseFile(jsonPath));
        return DependencyGraph.compile(def, gateway);
    }

    /** A runtime configured from {@code viewgraph.properties}, not yet started. */
    public static ViewRuntime runtime(String viewId, DependencyGraph graph) {
        return new ViewRuntime(viewId, graph, ViewRuntimeConfig.load());
    }
}
