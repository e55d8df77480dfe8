/**
 * Serialized single-writer transaction engine over a {@link com.ryuqq.controlplane.core.spi.BackingStore}.
 */
package com.ryuqq.controlplane.core.store;
