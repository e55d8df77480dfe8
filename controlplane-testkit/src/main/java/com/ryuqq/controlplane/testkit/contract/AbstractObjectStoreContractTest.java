package com.ryuqq.controlplane.testkit.contract;

import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.spi.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Tests every {@link ObjectStore} implementation must pass.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public abstract class AbstractObjectStoreContractTest {

    protected ObjectStore objectStore;

    protected abstract ObjectStore createObjectStore();

    @BeforeEach
    void setUpObjectStore() {
        objectStore = createObjectStore();
    }

    @Test
    void testPutThenGet_ReturnsBodyAndContentType() {
        byte[] body = "hello".getBytes(StandardCharsets.UTF_8);

        objectStore.put(ObjectTarget.snapshot("snap_1"), body, "text/plain");
        Optional<StoredObject> stored = objectStore.get(ObjectTarget.snapshot("snap_1"));

        assertTrue(stored.isPresent());
        assertArrayEquals(body, stored.get().body());
        assertEquals("text/plain", stored.get().contentType());
    }

    @Test
    void testGet_WhenMissing_ReturnsEmpty() {
        assertTrue(objectStore.get(ObjectTarget.bundle("tplv_missing")).isEmpty());
    }

    @Test
    void testPut_SameId_DifferentKinds_AreIndependent() {
        objectStore.put(ObjectTarget.buildLog("bld_1"), "log".getBytes(StandardCharsets.UTF_8), "text/plain");
        objectStore.put(ObjectTarget.buildArtifact("bld_1"), "{}".getBytes(StandardCharsets.UTF_8),
            "application/json");

        assertEquals("log", new String(objectStore.get(ObjectTarget.buildLog("bld_1")).orElseThrow().body(),
            StandardCharsets.UTF_8));
        assertEquals("{}", new String(objectStore.get(ObjectTarget.buildArtifact("bld_1")).orElseThrow().body(),
            StandardCharsets.UTF_8));
    }

    @Test
    void testPut_Overwrites() {
        objectStore.put(ObjectTarget.bundle("tplv_1"), new byte[] {1}, "application/zip");
        objectStore.put(ObjectTarget.bundle("tplv_1"), new byte[] {2, 3}, "application/gzip");

        StoredObject stored = objectStore.get(ObjectTarget.bundle("tplv_1")).orElseThrow();
        assertArrayEquals(new byte[] {2, 3}, stored.body());
        assertEquals("application/gzip", stored.contentType());
    }

    @Test
    void testDelete_RemovesObject_AndIgnoresMissing() {
        objectStore.put(ObjectTarget.snapshot("snap_1"), new byte[] {1}, "application/octet-stream");

        objectStore.delete(ObjectTarget.snapshot("snap_1"));
        objectStore.delete(ObjectTarget.snapshot("snap_never"));

        assertTrue(objectStore.get(ObjectTarget.snapshot("snap_1")).isEmpty());
    }
}
