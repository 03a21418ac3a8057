package com.viewstate.drg.util;

import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.dsl.ViewDefinition;
import com.viewstate.drg.engine.ComputationExecutor;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.engine.StabilizationEngine;
import com.viewstate.drg.resource.ResourceGateway;
import com.viewstate.drg.store.InMemoryFieldStore;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private StabilizationEngine engine;
    private GraphExplain explain;

    @Before
    public void setUp() {
        ViewDefinition def = ViewDefinition.builder("counter")
                .field("count", 5L)
                .derive("doubled", d -> (Long) d.get("count") * 2, "field:count")
                .deriveAsync("remote", d -> d.get("doubled"), "result:doubled")
                .build();
        engine = new StabilizationEngine(OwnerAddress.view("v1"), DependencyGraph.compile(def, ResourceGateway.empty()),
                new InMemoryFieldStore(def), new ComputationExecutor(r -> {
                }, (owner, node, gen, outcome) -> {
                }));
        engine.recomputeAll();
        explain = new GraphExplain(engine);
    }

    @Test
    public void testExplainNode() {
        String text = explain.explainNode("doubled");
        assertTrue(text, text.contains("Depends on: count"));
        assertTrue(text, text.contains("State: Ready(10)"));
        assertTrue(text, text.contains("Dependents (1): remote"));
    }

    @Test
    public void testDumpTopology() {
        String text = explain.dumpTopology();
        assertTrue(text, text.contains("field count : OBJECT (EPHEMERAL)"));
        assertTrue(text, text.contains("[0] doubled <- count"));
        assertTrue(text, text.contains("[1] remote (ASYNC) <- doubled"));
    }

    @Test
    public void testMermaid() {
        String text = explain.toMermaid();
        assertTrue(text.startsWith("graph TD;"));
        assertTrue(text, text.contains("count --> doubled;"));
        assertTrue(text, text.contains("doubled -.-> remote;"));
        assertTrue(text, text.contains("remote<br/>loading"));
    }

    @Test
    public void testLastStabilization() {
        assertEquals("v1 generation: 1, Recomputed: 2/2", explain.explainLastStabilization());
    }
}
