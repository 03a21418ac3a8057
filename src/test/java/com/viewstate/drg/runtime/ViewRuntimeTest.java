package com.viewstate.drg.runtime;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.dsl.SourceRef;
import com.viewstate.drg.dsl.ViewDefinition;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.resource.CountingGateway;
import com.viewstate.drg.resource.FormDraft;
import com.viewstate.drg.resource.ResourceGateway;
import com.viewstate.drg.util.NodeProfileListener;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.Assert.*;

public class ViewRuntimeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ViewRuntime runtime;

    @After
    public void tearDown() {
        if (runtime != null)
            runtime.close();
    }

    private ViewRuntime start(ViewDefinition def, ResourceGateway gateway) {
        ViewRuntimeConfig config = ViewRuntimeConfig.builder().ringBufferSize(64).workerThreads(2).build();
        runtime = new ViewRuntime("v1", DependencyGraph.compile(def, gateway), config);
        return runtime;
    }

    private ComputationState state(String node) {
        return runtime.query(v -> v.state(node)).join();
    }

    @Test
    public void testCountDoubled() {
        start(ViewDefinition.builder("counter")
                .field("count", 0L)
                .derive("doubled", d -> (Long) d.get("count") * 2, "field:count")
                .build(), ResourceGateway.empty()).start();

        assertEquals(ComputationState.ready(0L), state("doubled"));

        runtime.setField("count", 5L);
        assertEquals(ComputationState.ready(10L), state("doubled"));
    }

    @Test
    public void testBurstOfWritesSettlesOnLastValue() {
        start(ViewDefinition.builder("counter")
                .field("count", 0L)
                .derive("doubled", d -> (Long) d.get("count") * 2, "field:count")
                .build(), ResourceGateway.empty()).start();

        for (long i = 1; i <= 100; i++)
            runtime.setField("count", i);

        assertEquals(ComputationState.ready(200L), state("doubled"));
    }

    @Test
    public void testAsyncReadLoadsThenCompletes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ResourceGateway slow = (resource, id, action) -> {
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(Map.of("id", id, "name", "Lamp"));
        };
        start(ViewDefinition.builder("edit")
                .field("product_id", "p1")
                .read("product", "Product", SourceRef.field("product_id"))
                .form("form", "Product", SourceRef.result("product"))
                .build(), slow).start();

        assertTrue(state("product").isLoading());
        assertTrue(state("form").isLoading());

        release.countDown();
        await().atMost(TIMEOUT).until(() -> state("product").isReady());

        assertEquals(ComputationState.readyAsync(Map.of("id", "p1", "name", "Lamp")), state("product"));
        ComputationState.Ready form = (ComputationState.Ready) state("form");
        assertTrue(form.async());
        assertFalse(((FormDraft) form.value()).isCreate());
    }

    @Test
    public void testLatestAsyncResultWins() throws Exception {
        start(ViewDefinition.builder("search")
                .field("query", "a")
                .deriveAsync("results", d -> {
                    String q = (String) d.get("query");
                    // Earlier queries are slower, so their results arrive last.
                    Thread.sleep(q.length() == 1 ? 300 : 10);
                    return "results for " + q;
                }, "field:query")
                .build(), ResourceGateway.empty()).start();

        runtime.setField("query", "ab");

        await().atMost(TIMEOUT).until(() -> state("results").isReady());
        assertEquals(ComputationState.readyAsync("results for ab"), state("results"));

        // Give the slow, older task time to finish and be discarded.
        Thread.sleep(500);
        assertEquals(ComputationState.readyAsync("results for ab"), state("results"));
    }

    @Test
    public void testComponentLifecycle() {
        CountingGateway gateway = new CountingGateway().put("Product", "p1", Map.of("id", "p1"));
        ViewDefinition card = ViewDefinition.builder("card")
                .prop("product_id")
                .read("product", "Product", SourceRef.prop("product_id"))
                .build();
        start(ViewDefinition.builder("page").field("title", "home").build(), gateway).start();
        DependencyGraph cardGraph = DependencyGraph.compile(card, gateway);

        runtime.mountComponent("card", cardGraph, Map.of("product_id", "p1")).join();
        OwnerAddress addr = OwnerAddress.component("v1", "card");
        await().atMost(TIMEOUT).until(() -> runtime.query(v -> v.state(addr, "product")).join().isReady());

        runtime.invalidateResource("Product");
        await().atMost(TIMEOUT).until(() -> gateway.fetches() == 2);

        assertTrue(runtime.unmountComponent("card").join());
        assertTrue(runtime.query(v -> v.componentIds().isEmpty()).join());
    }

    @Test
    public void testFailingCommandDoesNotStopConsumer() {
        start(ViewDefinition.builder("v").field("x", 1L).build(), ResourceGateway.empty()).start();

        try {
            runtime.updateProps("missing", Map.of()).join();
            fail("Expected failure");
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }

        runtime.setField("nope", 1);
        assertEquals(1L, runtime.query(v -> v.field("x")).join());
    }

    @Test
    public void testListenerAndCallback() {
        NodeProfileListener profile = new NodeProfileListener();
        AtomicInteger callbacks = new AtomicInteger();
        start(ViewDefinition.builder("counter")
                .field("count", 0L)
                .derive("doubled", d -> (Long) d.get("count") * 2, "field:count")
                .build(), ResourceGateway.empty());
        runtime.addListener(profile);
        runtime.setPostStabilizationCallback((instance, n) -> callbacks.incrementAndGet());
        runtime.start();

        runtime.setField("count", 1L);
        state("doubled");

        assertEquals(2, profile.invocations("doubled"));
        assertTrue(callbacks.get() >= 1);
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishBeforeStart() {
        start(ViewDefinition.builder("v").field("x", 1L).build(), ResourceGateway.empty());
        runtime.setField("x", 2L);
    }

    @Test
    public void testCloseWithoutStartReleasesWorkers() {
        start(ViewDefinition.builder("v").field("x", 1L).build(), ResourceGateway.empty());
        assertFalse(runtime.isWorkerPoolShutdown());

        runtime.close();
        assertTrue(runtime.isWorkerPoolShutdown());
    }

    @Test
    public void testCloseAfterStart() {
        start(ViewDefinition.builder("v").field("x", 1L).build(), ResourceGateway.empty()).start();
        assertEquals(1L, runtime.query(v -> v.field("x")).join());

        runtime.close();
        assertFalse(runtime.isRunning());
        assertTrue(runtime.isWorkerPoolShutdown());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRingSizeMustBePowerOfTwo() {
        new ViewRuntime("v1", DependencyGraph.compile(ViewDefinition.builder("v").build(), ResourceGateway.empty()),
                ViewRuntimeConfig.builder().ringBufferSize(100).build());
    }
}
