/**
 * In-memory state and object storage.
 *
 * <p>{@link com.ryuqq.controlplane.adapter.inmemory.store.InMemoryBackingStore} keeps the whole
 * state document and honors save scopes; {@link com.ryuqq.controlplane.adapter.inmemory.store.InMemoryObjectStore}
 * keeps bundle, snapshot and build output bodies keyed by target.</p>
 */
package com.ryuqq.controlplane.adapter.inmemory.store;
