package com.ryuqq.controlplane.adapter.inmemory.store;

import com.ryuqq.controlplane.core.spi.BackingStore;
import com.ryuqq.controlplane.core.state.EntityCollection;
import com.ryuqq.controlplane.core.state.StateDocument;

import java.util.Set;

/**
 * In-memory implementation of {@link BackingStore} for tests and single-process use.
 *
 * <p>Holds one {@link StateDocument}. Every save stores a deep copy and every load returns one,
 * so callers never share entity references with the stored state.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No scoped load (whole document per transaction)</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class InMemoryBackingStore implements BackingStore {

    private StateDocument stored;
    private int saveCount;

    public InMemoryBackingStore() {
        this(StateDocument.empty());
    }

    /**
     * Creates a store seeded with the given document.
     *
     * @param initial initial state (copied)
     */
    public InMemoryBackingStore(StateDocument initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.stored = initial.deepCopy();
    }

    @Override
    public synchronized StateDocument load() {
        return stored.deepCopy();
    }

    @Override
    public synchronized void save(StateDocument next, StateDocument previous, Set<EntityCollection> collections) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (collections == null) {
            throw new IllegalArgumentException("collections cannot be null");
        }
        StateDocument copy = next.deepCopy();
        if (collections.containsAll(EntityCollection.all())) {
            stored = copy;
        } else {
            stored.replaceCollections(copy, collections);
        }
        saveCount++;
    }

    /**
     * Number of successful saves (for tests).
     */
    public synchronized int saveCount() {
        return saveCount;
    }

    /**
     * Clears all stored state.
     */
    public synchronized void clear() {
        stored = StateDocument.empty();
        saveCount = 0;
    }
}
