package com.viewstate.drg.engine;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.ComputeOutcome;
import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.dsl.ViewDefinition;
import com.viewstate.drg.resource.ResourceGateway;
import com.viewstate.drg.store.InMemoryFieldStore;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class AsyncResultRouterTest {

    private static final OwnerAddress OWNER = OwnerAddress.view("v1");

    private ManualExecutor background;
    private RecordingSink sink;
    private InMemoryFieldStore store;
    private StabilizationEngine engine;
    private AsyncResultRouter router;

    @Before
    public void setUp() {
        ViewDefinition def = ViewDefinition.builder("search")
                .field("query", "a")
                .deriveAsync("results", d -> "results for " + d.get("query"), "field:query")
                .derive("summary", d -> "[" + d.get("results") + "]", "result:results")
                .derive("echo", d -> d.get("query"), "field:query")
                .build();
        background = new ManualExecutor();
        sink = new RecordingSink();
        store = new InMemoryFieldStore(def);
        engine = new StabilizationEngine(OWNER, DependencyGraph.compile(def, ResourceGateway.empty()), store,
                new ComputationExecutor(background, sink));
        router = new AsyncResultRouter(owner -> OWNER.equals(owner) ? engine : null);
    }

    private List<RecordingSink.Completion> runTasks() {
        background.runAll();
        return sink.drain();
    }

    @Test
    public void testAppliesResultAndRecomputesDependents() {
        engine.recomputeAll();
        RecordingSink.Completion c = runTasks().get(0);

        assertEquals(AsyncResultRouter.Delivery.APPLIED,
                router.deliver(c.owner(), c.nodeName(), c.generation(), c.outcome()));
        assertEquals(ComputationState.readyAsync("results for a"), store.getNodeState("results"));
        assertEquals(ComputationState.readyAsync("[results for a]"), store.getNodeState("summary"));
    }

    @Test
    public void testOlderResultIsDiscarded() {
        engine.recomputeAll();
        store.putField("query", "ab");
        engine.recomputeDirty();

        List<RecordingSink.Completion> done = runTasks();
        assertEquals(2, done.size());
        RecordingSink.Completion first = done.get(0);
        RecordingSink.Completion second = done.get(1);
        assertTrue(first.generation() < second.generation());

        // The newer result lands first, then the older one arrives late.
        assertEquals(AsyncResultRouter.Delivery.APPLIED,
                router.deliver(OWNER, "results", second.generation(), second.outcome()));
        assertEquals(AsyncResultRouter.Delivery.STALE,
                router.deliver(OWNER, "results", first.generation(), first.outcome()));

        assertEquals(ComputationState.readyAsync("results for ab"), store.getNodeState("results"));
    }

    @Test
    public void testSupersededResultArrivingFirstIsDiscarded() {
        engine.recomputeAll();
        store.putField("query", "ab");
        engine.recomputeDirty();

        List<RecordingSink.Completion> done = runTasks();
        RecordingSink.Completion first = done.get(0);

        assertEquals(AsyncResultRouter.Delivery.STALE,
                router.deliver(OWNER, "results", first.generation(), first.outcome()));
        assertTrue(store.getNodeState("results").isLoading());
    }

    @Test
    public void testFailedResultPropagates() {
        engine.recomputeAll();
        RecordingSink.Completion c = runTasks().get(0);

        router.deliver(OWNER, "results", c.generation(), ComputeOutcome.err(new IllegalStateException("timeout")));

        assertEquals(ComputationState.failed("timeout"), store.getNodeState("results"));
        assertEquals(ComputationState.failed("timeout"), store.getNodeState("summary"));
    }

    @Test
    public void testUnrelatedNodesUntouchedOnDelivery() {
        engine.recomputeAll();
        long before = engine.generation();
        RecordingSink.Completion c = runTasks().get(0);
        router.deliver(c.owner(), c.nodeName(), c.generation(), c.outcome());

        // One dependents-only pass, covering "summary" alone.
        assertEquals(before + 1, engine.generation());
        assertEquals(1, engine.lastStabilizedCount());
    }

    @Test
    public void testUnknownOwnerIsDropped() {
        assertEquals(AsyncResultRouter.Delivery.UNKNOWN_OWNER,
                router.deliver(OwnerAddress.component("v1", "gone"), "results", 1, ComputeOutcome.ok("x")));
    }

    @Test
    public void testUnknownOrSyncNodeIsDropped() {
        engine.recomputeAll();
        assertEquals(AsyncResultRouter.Delivery.UNKNOWN_NODE,
                router.deliver(OWNER, "nope", 1, ComputeOutcome.ok("x")));
        assertEquals(AsyncResultRouter.Delivery.UNKNOWN_NODE,
                router.deliver(OWNER, "echo", 1, ComputeOutcome.ok("x")));
        assertEquals(ComputationState.ready("a"), store.getNodeState("echo"));
    }
}
