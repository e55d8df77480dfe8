package com.ryuqq.controlplane.adapter.inmemory.store;

import com.ryuqq.controlplane.core.spi.BackingStore;
import com.ryuqq.controlplane.core.state.EntityCollection;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.testkit.contract.AbstractBackingStoreContractTest;
import com.ryuqq.controlplane.testkit.fixture.StateFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Contract Tests for {@link InMemoryBackingStore}.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
class InMemoryBackingStoreContractTest extends AbstractBackingStoreContractTest {

    @Override
    protected BackingStore createStore() {
        return new InMemoryBackingStore();
    }

    @Test
    void testSave_StoresCopy_CallerMutationsDoNotLeak() {
        // Given
        StateDocument document = StateFixtures.populated("a");
        saveAll(document, StateDocument.empty());

        // When: caller keeps mutating its own reference
        document.getUsers().get(0).setName("Mutated after save");
        store.load().getUsers().get(0).setName("Mutated after load");

        // Then
        assertEquals("Dev a", store.load().getUsers().get(0).getName());
    }

    @Test
    void testSupportsScopedLoad_IsFalse() {
        assertFalse(store.supportsScopedLoad());
    }

    @Test
    void testSeededConstructor_LoadsSeed() {
        InMemoryBackingStore seeded = new InMemoryBackingStore(StateFixtures.populated("seed"));

        assertEquals(1, seeded.load().size(EntityCollection.WORKSPACES));
        assertEquals(0, seeded.saveCount());
    }
}
