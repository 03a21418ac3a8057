package com.viewstate.drg.engine;

import com.viewstate.drg.api.GraphConfigurationException;
import com.viewstate.drg.api.Node;
import com.viewstate.drg.dsl.FormDeclaration;
import com.viewstate.drg.dsl.ReadDeclaration;
import com.viewstate.drg.dsl.SourceRef;
import com.viewstate.drg.dsl.ViewDefinition;
import com.viewstate.drg.resource.CountingGateway;
import com.viewstate.drg.resource.FormDraft;
import org.junit.Before;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class NodeBuilderTest {

    private CountingGateway gateway;
    private NodeBuilder builder;

    @Before
    public void setUp() {
        gateway = new CountingGateway().put("Product", "p1", Map.of("id", "p1", "name", "Lamp"));
        builder = new NodeBuilder(gateway);
    }

    private static Node find(List<Node> nodes, String name) {
        for (Node n : nodes)
            if (n.name().equals(name))
                return n;
        throw new AssertionError("No node " + name);
    }

    @Test
    public void testDeriveResolvesAllReferenceShapes() {
        ViewDefinition def = ViewDefinition.builder("v")
                .field("count", 0L)
                .prop("scale")
                .derive("doubled", d -> null, "field:count")
                .derive("scaled", d -> null, "result:doubled", "prop:scale", "count")
                .build();

        Node scaled = find(builder.build(def), "scaled");
        assertEquals(List.of("doubled", "scale", "count"), scaled.dependsOn());
        assertFalse(scaled.async());
    }

    @Test
    public void testUnresolvableReferenceNamesTheNode() {
        ViewDefinition def = ViewDefinition.builder("v")
                .derive("broken", d -> null, "field:missing")
                .build();
        try {
            builder.build(def);
            fail("Expected configuration error");
        } catch (GraphConfigurationException e) {
            assertEquals("broken", e.offendingName());
            assertTrue(e.getMessage().contains("field:missing"));
        }
    }

    @Test(expected = GraphConfigurationException.class)
    public void testReferenceShapeMustMatch() {
        // "count" is a field, not a node result
        ViewDefinition def = ViewDefinition.builder("v")
                .field("count", 0L)
                .derive("doubled", d -> null, "result:count")
                .build();
        builder.build(def);
    }

    @Test
    public void testReadNodeShape() throws Exception {
        ViewDefinition def = ViewDefinition.builder("v")
                .field("product_id", null)
                .read("product", "Product", SourceRef.field("product_id"))
                .build();

        Node product = find(builder.build(def), "product");
        assertEquals(List.of("product_id"), product.dependsOn());
        assertTrue(product.async());
        assertEquals(Set.of("Product"), product.reads());

        Map<String, Object> deps = new HashMap<>();
        deps.put("product_id", "p1");
        assertEquals(Map.of("id", "p1", "name", "Lamp"), product.compute().compute(deps));
    }

    @Test
    public void testReadWithNullIdSkipsGateway() throws Exception {
        ViewDefinition def = ViewDefinition.builder("v")
                .field("product_id", null)
                .read("product", "Product", SourceRef.field("product_id"))
                .build();
        Node product = find(builder.build(def), "product");

        Map<String, Object> deps = new HashMap<>();
        deps.put("product_id", null);
        assertNull(product.compute().compute(deps));
        assertEquals(0, gateway.fetches());
    }

    @Test
    public void testReadOfMissingRecordIsNull() throws Exception {
        ViewDefinition def = ViewDefinition.builder("v")
                .field("product_id", null)
                .declare(new ReadDeclaration("product", "Product", SourceRef.field("product_id"), null, false))
                .build();
        Node product = find(builder.build(def), "product");

        assertFalse(product.async());
        assertNull(product.compute().compute(Map.of("product_id", "nope")));
        assertEquals(1, gateway.fetches());
    }

    @Test
    public void testFormDefaultsToParamsField() throws Exception {
        ViewDefinition def = ViewDefinition.builder("v")
                .field("product_id", null)
                .read("product", "Product", SourceRef.field("product_id"))
                .form("form", "Product", SourceRef.result("product"))
                .build();

        assertTrue(def.isField("form_params"));
        Node form = find(builder.build(def), "form");
        assertEquals(List.of("product", "form_params"), form.dependsOn());
        assertFalse(form.async());

        Map<String, Object> deps = new HashMap<>();
        deps.put("product", Map.of("id", "p1"));
        deps.put("form_params", Map.of("name", "Desk"));
        FormDraft draft = (FormDraft) form.compute().compute(deps);
        assertEquals(FormDraft.ActionType.UPDATE, draft.actionType());
        assertEquals("update", draft.action());
        assertEquals(Map.of("name", "Desk"), draft.params());
    }

    @Test
    public void testFormWithoutDataIsCreate() throws Exception {
        ViewDefinition def = ViewDefinition.builder("v")
                .field("input", Map.of())
                .declare(new FormDeclaration("form", "Product", null, SourceRef.field("input"), "insert", null))
                .build();

        assertFalse(def.isField("form_params"));
        Node form = find(builder.build(def), "form");
        assertEquals(List.of("input"), form.dependsOn());

        Map<String, Object> deps = new HashMap<>();
        deps.put("input", null);
        FormDraft draft = (FormDraft) form.compute().compute(deps);
        assertTrue(draft.isCreate());
        assertEquals("insert", draft.action());
        assertTrue(draft.params().isEmpty());
    }

    @Test
    public void testCompiledGraphIndexesDependentsAndResources() {
        ViewDefinition def = ViewDefinition.builder("v")
                .field("product_id", null)
                .read("product", "Product", SourceRef.field("product_id"))
                .form("form", "Product", SourceRef.result("product"))
                .derive("title", d -> null, "result:product")
                .build();

        DependencyGraph graph = DependencyGraph.compile(def, gateway);
        assertEquals(3, graph.nodeCount());
        assertEquals("product", graph.nodes().get(0).name());
        assertEquals(List.of("form", "title"), graph.dependents("product"));
        assertEquals(Set.of("product", "form"), graph.namesForResource("Product"));
        assertTrue(graph.namesForResource("Order").isEmpty());
    }

    @Test(expected = GraphConfigurationException.class)
    public void testCompileRejectsCycle() {
        ViewDefinition def = ViewDefinition.builder("v")
                .derive("a", d -> null, "result:b")
                .derive("b", d -> null, "result:a")
                .build();
        DependencyGraph.compile(def, gateway);
    }
}
