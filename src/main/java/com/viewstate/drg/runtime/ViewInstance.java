package com.viewstate.drg.runtime;

import com.viewstate.drg.api.ComputationState;
import com.viewstate.drg.api.ComputeOutcome;
import com.viewstate.drg.api.OwnerAddress;
import com.viewstate.drg.api.StabilizationListener;
import com.viewstate.drg.dsl.StorageClass;
import com.viewstate.drg.engine.AsyncResultRouter;
import com.viewstate.drg.engine.ComputationExecutor;
import com.viewstate.drg.engine.DependencyGraph;
import com.viewstate.drg.engine.StabilizationEngine;

import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * One live view together with its mounted components.
 *
 * The view and each component are separate owners with their own store and
 * engine. Pass generations come from one counter for the whole view, so a
 * late result for an unmounted component never matches a later mount under
 * the same id. All owners share one {@link ComputationExecutor},
 * and they share the thread of whoever drives this instance (normally the
 * {@link ViewRuntime} consumer). Nothing here is thread safe.
 *
 * Field writes only mark names dirty; {@link #stabilize()} runs the pending
 * dirty passes. Component mounts, prop updates and resource invalidations run
 * their passes immediately.
 */
@Log4j2
public final class ViewInstance implements AsyncResultRouter.OwnerResolver {
    private final String viewId;
    private final ComputationExecutor executor;
    private final StabilizationListener listener;
    private final AsyncResultRouter router;
    private final OwnerContext root;
    private final Map<String, OwnerContext> components = new LinkedHashMap<>();

    private boolean mounted;
    // Last pass generation handed out to any owner of this view.
    private long lastGeneration;

    public ViewInstance(String viewId, DependencyGraph graph, ComputationExecutor executor,
            StabilizationListener listener) {
        this.viewId = Objects.requireNonNull(viewId, "viewId");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.listener = listener;
        this.router = new AsyncResultRouter(this);
        this.root = new OwnerContext(OwnerAddress.view(viewId), graph, executor, listener, this::nextGeneration);
    }

    private long nextGeneration() {
        return ++lastGeneration;
    }

    // ── Lifecycle ────────────────────────────────────────────────

    /** Runs the initial full pass with default field values. */
    public int mount() {
        return mount(Map.of(), Map.of());
    }

    /**
     * Hydrates URL and socket fields from their string form, then runs the
     * initial full pass.
     */
    public int mount(Map<String, String> urlParams, Map<String, String> connectParams) {
        if (mounted)
            throw new IllegalStateException("View " + viewId + " already mounted");
        mounted = true;
        root.store().hydrate(StorageClass.URL, urlParams);
        root.store().hydrate(StorageClass.SOCKET, connectParams);
        int n = root.engine().recomputeAll();
        log.debug("Mounted view {} ({} node(s))", viewId, n);
        return n;
    }

    public boolean isMounted() {
        return mounted;
    }

    // ── Components ───────────────────────────────────────────────

    /**
     * Mounts a component under this view and runs its full pass.
     *
     * @throws IllegalArgumentException if the id is taken or a prop is not declared
     */
    public int mountComponent(String componentId, DependencyGraph graph, Map<String, ?> props) {
        if (components.containsKey(componentId))
            throw new IllegalArgumentException("Component already mounted: " + componentId);
        OwnerContext ctx = new OwnerContext(OwnerAddress.component(viewId, componentId), graph, executor, listener,
                this::nextGeneration);
        for (Map.Entry<String, ?> e : props.entrySet())
            ctx.store().putProp(e.getKey(), e.getValue());
        components.put(componentId, ctx);
        int n = ctx.engine().recomputeAll();
        log.debug("Mounted component {} of view {} ({} node(s))", componentId, viewId, n);
        return n;
    }

    /**
     * Applies new props from the parent. Only props whose value changed are
     * marked dirty.
     *
     * @return number of nodes recomputed
     */
    public int updateProps(String componentId, Map<String, ?> props) {
        OwnerContext ctx = component(componentId);
        for (Map.Entry<String, ?> e : props.entrySet())
            ctx.store().putProp(e.getKey(), e.getValue());
        return ctx.engine().recomputeDirty();
    }

    /** Drops a component; async results still in flight for it are discarded on arrival. */
    public boolean unmountComponent(String componentId) {
        boolean removed = components.remove(componentId) != null;
        if (removed)
            log.debug("Unmounted component {} of view {}", componentId, viewId);
        return removed;
    }

    public Set<String> componentIds() {
        return Collections.unmodifiableSet(components.keySet());
    }

    // ── Mutation ─────────────────────────────────────────────────

    /** Writes a field of the view; takes effect on the next {@link #stabilize()}. */
    public void setField(String name, Object value) {
        root.store().putField(name, value);
    }

    public void setField(OwnerAddress owner, String name, Object value) {
        context(owner).store().putField(name, value);
    }

    /** Marks a field or node of {@code owner} dirty without changing it. */
    public void markDirty(OwnerAddress owner, String name) {
        context(owner).store().markDirty(name);
    }

    /**
     * Marks every node that reads {@code resource}, in the view and in every
     * component, dirty.
     *
     * @return number of names marked
     */
    public int markResourceDirty(String resource) {
        int marked = 0;
        for (OwnerContext ctx : owners()) {
            for (String name : ctx.graph().namesForResource(resource)) {
                ctx.store().markDirty(name);
                marked++;
            }
        }
        return marked;
    }

    /** Marks readers of {@code resource} dirty and recomputes them. */
    public int invalidateResource(String resource) {
        if (markResourceDirty(resource) == 0)
            return 0;
        return stabilize();
    }

    /**
     * Runs the pending dirty pass of the view, then of each component.
     *
     * @return total number of nodes recomputed
     */
    public int stabilize() {
        int total = 0;
        for (OwnerContext ctx : owners())
            total += ctx.engine().recomputeDirty();
        return total;
    }

    /** Routes a finished async computation to its owner. */
    public AsyncResultRouter.Delivery deliver(OwnerAddress owner, String nodeName, long generation,
            ComputeOutcome outcome) {
        return router.deliver(owner, nodeName, generation, outcome);
    }

    @Override
    public StabilizationEngine resolve(OwnerAddress owner) {
        if (!viewId.equals(owner.viewId()))
            return null;
        if (!owner.isComponent())
            return root.engine();
        OwnerContext ctx = components.get(owner.componentId());
        return ctx == null ? null : ctx.engine();
    }

    // ── Queries ──────────────────────────────────────────────────

    public String viewId() {
        return viewId;
    }

    public OwnerContext root() {
        return root;
    }

    /** @throws IllegalArgumentException if no such component is mounted */
    public OwnerContext component(String componentId) {
        OwnerContext ctx = components.get(componentId);
        if (ctx == null)
            throw new IllegalArgumentException("Unknown component " + componentId + " in view " + viewId);
        return ctx;
    }

    public OwnerContext context(OwnerAddress owner) {
        if (!viewId.equals(owner.viewId()))
            throw new IllegalArgumentException("Owner " + owner + " does not belong to view " + viewId);
        return owner.isComponent() ? component(owner.componentId()) : root;
    }

    public ComputationState state(String nodeName) {
        return root.store().getNodeState(nodeName);
    }

    public ComputationState state(OwnerAddress owner, String nodeName) {
        return context(owner).store().getNodeState(nodeName);
    }

    public Object field(String name) {
        return root.store().getField(name);
    }

    private List<OwnerContext> owners() {
        List<OwnerContext> all = new ArrayList<>(components.size() + 1);
        all.add(root);
        all.addAll(components.values());
        return all;
    }
}
