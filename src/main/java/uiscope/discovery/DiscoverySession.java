package uiscope.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uiscope.hierarchy.HierarchyAnalysisResult;
import uiscope.hierarchy.HierarchyBuilder;
import uiscope.model.UIElement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller-side guard for hosts that trigger discovery repeatedly, e.g. on every
 * click in an inspector UI.
 *
 * <p>The session moves {@code IDLE -> RUNNING -> IDLE} around each request. A
 * request that arrives while another is {@code RUNNING} is dropped, not queued,
 * and counted in {@link #getDroppedRequests()}. Completed runs replace the single
 * result slot. There is no cancellation: a started run always finishes.
 *
 * <p>Thread-safe. The engine it drives is stateless; only the slot and the state
 * live here.
 */
public class DiscoverySession {

    private static final Logger log = LoggerFactory.getLogger(DiscoverySession.class);

    public enum State { IDLE, RUNNING }

    private final HierarchyBuilder builder;
    private final DiscoveryEngine  engine;

    private final AtomicReference<State>                   state      = new AtomicReference<>(State.IDLE);
    private final AtomicReference<HierarchyAnalysisResult> hierarchy  = new AtomicReference<>();
    private final AtomicReference<DiscoveryResult>         lastResult = new AtomicReference<>();
    private final AtomicLong                               dropped    = new AtomicLong();

    public DiscoverySession(HierarchyBuilder builder, DiscoveryEngine engine) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.engine  = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Builds a fresh hierarchy from {@code elements} and runs discovery for
     * {@code targetId} on the calling thread.
     *
     * @return the result, or empty if another request was still running
     */
    public Optional<DiscoveryResult> submit(List<UIElement> elements, String targetId) {
        Objects.requireNonNull(elements, "elements must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");

        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            long count = dropped.incrementAndGet();
            log.debug("Discovery for '{}' dropped, session busy ({} dropped so far)", targetId, count);
            return Optional.empty();
        }
        try {
            HierarchyAnalysisResult built = builder.analyzeHierarchy(elements);
            DiscoveryResult result = engine.discover(built, targetId);
            hierarchy.set(built);
            lastResult.set(result);
            return Optional.of(result);
        } finally {
            state.set(State.IDLE);
        }
    }

    public State getState() { return state.get(); }

    public boolean isBusy() { return state.get() == State.RUNNING; }

    /** Hierarchy of the last completed request. */
    public Optional<HierarchyAnalysisResult> getHierarchy() { return Optional.ofNullable(hierarchy.get()); }

    /** Result of the last completed request. */
    public Optional<DiscoveryResult> getLastResult() { return Optional.ofNullable(lastResult.get()); }

    public long getDroppedRequests() { return dropped.get(); }
}
