package com.ryuqq.controlplane.adapter.inmemory.store;

import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.spi.StoredObject;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ObjectStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Thread-safe. Bodies are defensively copied by {@link StoredObject}.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentHashMap<ObjectTarget, StoredObject> objects = new ConcurrentHashMap<>();

    @Override
    public void put(ObjectTarget target, byte[] body, String contentType) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        objects.put(target, new StoredObject(body, contentType));
    }

    @Override
    public Optional<StoredObject> get(ObjectTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return Optional.ofNullable(objects.get(target));
    }

    @Override
    public void delete(ObjectTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        objects.remove(target);
    }

    public boolean contains(ObjectTarget target) {
        return objects.containsKey(target);
    }

    public int size() {
        return objects.size();
    }

    public void clear() {
        objects.clear();
    }
}
