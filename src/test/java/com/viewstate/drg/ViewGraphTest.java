package com.viewstate.drg;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.GraphConfigurationException;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.resource.ResourceGateway;
import com.viewstate.drg.runtime.ViewRuntime;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class ViewGraphTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testBuildCompileRun() {
        DependencyGraph graph = ViewGraph.compile(ViewGraph.builder("counter")
                .field("count", 0L)
                .derive("doubled", d -> (Long) d.get("count") * 2, "field:count")
                .build(), ResourceGateway.empty());

        try (ViewRuntime rt = ViewGraph.runtime("counter-1", graph).start()) {
            rt.setField("count", 21L);
            assertEquals(ComputationState.ready(42L), rt.query(v -> v.state("doubled")).join());
        }
    }

    @Test
    public void testCompileJsonFile() throws Exception {
        Path file = tmp.newFile("toggle.json").toPath();
        Files.write(file, ("{\"view\": {\"name\": \"toggle\","
                + " \"fields\": [{\"name\": \"on\", \"type\": \"boolean\", \"default\": false}],"
                + " \"derive\": [{\"name\": \"off\", \"fn\": \"not\", \"arguments\": [\"field:on\"]}]}}")
                .getBytes(StandardCharsets.UTF_8));

        DependencyGraph graph = ViewGraph.compileJson(file, ResourceGateway.empty());
        assertEquals("toggle", graph.name());
        assertTrue(graph.isNode("off"));
    }

    @Test(expected = GraphConfigurationException.class)
    public void testCycleIsRejected() {
        ViewGraph.compile(ViewGraph.builder("loop")
                .derive("a", d -> 1, "result:b")
                .derive("b", d -> 2, "result:a")
                .build(), ResourceGateway.empty());
    }
}
