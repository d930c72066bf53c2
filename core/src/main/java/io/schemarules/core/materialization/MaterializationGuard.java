package io.schemarules.core.materialization;

import io.schemarules.core.error.MaterializationException;
import io.schemarules.core.spi.SchemaStore;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshot/diff protocol that keeps schemas materialized during one guarded span out of the
 * published document.
 *
 * <ol>
 *   <li>{@link #snapshot()} records the ids present in the store.
 *   <li>The span runs; {@code getSchemaForType} may add entries.
 *   <li>{@link #cleanup(Set)} removes every id created during the span that is not reachable from
 *       the span's emitted roots.
 * </ol>
 *
 * <p>Ids present at snapshot time are never removed. One guard serves one span at a time and is
 * not thread-safe.
 */
public final class MaterializationGuard {

    private static final Logger LOG = LoggerFactory.getLogger(MaterializationGuard.class);

    private final SchemaStore store;
    private Set<String> snapshotIds;

    public MaterializationGuard(SchemaStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Records the ids currently in the store.
     *
     * @throws MaterializationException if a snapshot is already open
     */
    public void snapshot() {
        if (snapshotIds != null) {
            throw new MaterializationException("Snapshot already taken; call cleanup() before taking another");
        }
        snapshotIds = Set.copyOf(store.schemaIds());
    }

    /** {@code true} between {@link #snapshot()} and {@link #cleanup(Set)}. */
    public boolean isOpen() {
        return snapshotIds != null;
    }

    /**
     * Removes the schemas created since {@link #snapshot()} that are not reachable from {@code
     * emittedRoots} and closes the span.
     *
     * @param emittedRoots ids referenced by the span's final output; reachability is followed
     *     transitively through {@link SchemaStore#referencedIds(String)}
     * @return the removed ids, in store order
     * @throws MaterializationException if no snapshot is open
     */
    public Set<String> cleanup(Set<String> emittedRoots) {
        if (snapshotIds == null) {
            throw new MaterializationException("cleanup() called without a prior snapshot()");
        }
        Set<String> before = snapshotIds;
        snapshotIds = null;

        Set<String> created = new LinkedHashSet<>(store.schemaIds());
        created.removeAll(before);
        if (created.isEmpty()) {
            return Set.of();
        }

        Set<String> reachable = reachableFrom(emittedRoots != null ? emittedRoots : Set.of());
        Set<String> removed = new LinkedHashSet<>();
        for (String id : created) {
            if (!reachable.contains(id) && store.remove(id)) {
                removed.add(id);
            }
        }
        LOG.debug("schema.cleanup created={} removed={} kept={}", created, removed, created.size() - removed.size());
        return Collections.unmodifiableSet(removed);
    }

    /**
     * Runs {@code span} between {@link #snapshot()} and {@link #cleanup(Set)}. Cleanup also runs
     * when the span throws; the span's exception propagates.
     *
     * @param span the work that may materialize schemas
     * @param emittedRoots evaluated after the span, supplies the ids the final output references
     * @return the removed ids
     */
    public Set<String> run(Runnable span, Supplier<Set<String>> emittedRoots) {
        snapshot();
        try {
            span.run();
        } catch (RuntimeException | Error e) {
            cleanup(Set.of());
            throw e;
        }
        return cleanup(emittedRoots.get());
    }

    private Set<String> reachableFrom(Set<String> roots) {
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (visited.add(id)) {
                pending.addAll(store.referencedIds(id));
            }
        }
        return visited;
    }
}
