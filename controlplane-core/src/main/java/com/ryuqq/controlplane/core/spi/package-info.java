/**
 * Service Provider Interfaces for the control plane's external collaborators.
 *
 * <p>Adapters implement these interfaces:</p>
 * <ul>
 *   <li>{@link com.ryuqq.controlplane.core.spi.BackingStore}: state document persistence</li>
 *   <li>{@link com.ryuqq.controlplane.core.spi.ObjectStore}: bundle, snapshot and build output blobs</li>
 *   <li>{@link com.ryuqq.controlplane.core.spi.JobDispatcher}: post-commit work notification</li>
 *   <li>{@link com.ryuqq.controlplane.core.spi.CredentialVerifier}: opaque passkey verification</li>
 * </ul>
 */
package com.ryuqq.controlplane.core.spi;
