/**
 * Reusable contract tests for {@link com.ryuqq.controlplane.core.spi.BackingStore} and
 * {@link com.ryuqq.controlplane.core.spi.ObjectStore} implementations.
 *
 * <p>Adapter modules extend the abstract classes and supply a fresh store per test.</p>
 */
package com.ryuqq.controlplane.testkit.contract;
